package me.christianrobert.mspgsync.transfer.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.mspgsync.core.tools.PostgresIdentifierNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Counts the rows of a table on either side of the migration.
 */
@ApplicationScoped
public class RowCountService {

    private static final Logger log = LoggerFactory.getLogger(RowCountService.class);

    /**
     * @return Row count, or -1 if counting failed
     */
    public long countSourceRows(Connection sqlServerConnection, String schema, String tableName) {
        String sql = "SELECT COUNT_BIG(*) AS row_count FROM [" + schema.replace("]", "]]") + "].["
                + tableName.replace("]", "]]") + "]";
        return count(sqlServerConnection, sql, schema + "." + tableName);
    }

    /**
     * @return Row count, or -1 if counting failed
     */
    public long countTargetRows(Connection postgresConnection, String schema, String tableName) {
        String sql = "SELECT COUNT(*) AS row_count FROM " + PostgresIdentifierNormalizer.quoteQualified(schema, tableName);
        return count(postgresConnection, sql, schema + "." + tableName);
    }

    private long count(Connection connection, String sql, String tableName) {
        try (PreparedStatement stmt = connection.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return rs.getLong("row_count");
            }
            log.error("No result returned from count query for {}", tableName);
            return -1;
        } catch (SQLException e) {
            log.error("Failed to get row count for table: {}", tableName, e);
            return -1;
        }
    }
}
