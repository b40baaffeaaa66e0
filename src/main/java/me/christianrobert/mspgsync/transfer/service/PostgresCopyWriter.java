package me.christianrobert.mspgsync.transfer.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.postgresql.copy.CopyManager;
import org.postgresql.core.BaseConnection;

import java.io.IOException;
import java.io.StringReader;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Streams one CSV batch into PostgreSQL with COPY FROM STDIN.
 */
@ApplicationScoped
public class PostgresCopyWriter {

    /**
     * @return number of rows PostgreSQL reports as copied
     */
    public long copyIn(Connection connection, String copySql, String csv) throws SQLException, IOException {
        CopyManager copyManager = new CopyManager(connection.unwrap(BaseConnection.class));
        return copyManager.copyIn(copySql, new StringReader(csv));
    }
}
