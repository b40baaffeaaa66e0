package me.christianrobert.mspgsync.collation.job;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.collation.model.CollationMappingTable;
import me.christianrobert.mspgsync.collation.service.CollationMappingService;
import me.christianrobert.mspgsync.collation.service.CollationResolver;
import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.exception.CollationUnresolvedException;
import me.christianrobert.mspgsync.core.exception.ConnectivityException;
import me.christianrobert.mspgsync.core.job.AbstractDatabaseWriteJob;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.job.model.collation.CollationMigrationResult;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.tools.DdlLockRegistry;
import me.christianrobert.mspgsync.core.tools.PostgresIdentifierNormalizer;
import me.christianrobert.mspgsync.core.tools.TypeCategory;
import me.christianrobert.mspgsync.database.service.PostgresConnectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Step 4: applies the mapped collation to every text column whose source column has one.
 *
 * Installed collations are read once per run. A column resolving to the fallback marker keeps
 * the database default; an unresolved collation is recorded and the column left untouched.
 */
@Dependent
public class PostgresCollationMigrationJob extends AbstractDatabaseWriteJob<CollationMigrationResult> {

    private static final Logger log = LoggerFactory.getLogger(PostgresCollationMigrationJob.class);

    @Inject
    PostgresConnectionService postgresConnectionService;

    @Inject
    CollationMappingService collationMappingService;

    @Inject
    DdlLockRegistry ddlLockRegistry;

    @Override
    public String getTargetDatabase() {
        return "POSTGRES";
    }

    @Override
    public String getWriteOperationType() {
        return "COLLATION_MIGRATION";
    }

    @Override
    public Class<CollationMigrationResult> getResultType() {
        return CollationMigrationResult.class;
    }

    @Override
    protected void saveResultsToState(CollationMigrationResult result) {
        stateService.setCollationMigrationResult(result);
    }

    @Override
    protected CollationMigrationResult performWriteOperation(Consumer<JobProgress> progressCallback) throws Exception {
        updateProgress(progressCallback, 0, "Initializing", "Starting collation migration");

        CollationMigrationResult result = new CollationMigrationResult();

        if (configService.isEnabled(ConfigService.SKIP_COLLATIONS)) {
            result.markSkipped();
            updateProgress(progressCallback, 100, "Skipped", "Collation migration disabled by configuration");
            log.info("Collation migration disabled by configuration");
            return result;
        }

        List<TableDefinition> tables = stateService.getTableDefinitions();
        if (tables.isEmpty()) {
            updateProgress(progressCallback, 100, "No tables to process",
                    "No table definitions found in state. Run table creation first.");
            log.warn("No table definitions found in state for collation migration");
            return result;
        }

        CollationMappingTable mappingTable = collationMappingService.snapshot();

        try (Connection connection = postgresConnectionService.getConnection()) {
            Set<String> installed = loadInstalledCollations(connection);
            updateProgress(progressCallback, 10, "Collations loaded",
                    String.format("%d collations installed on PostgreSQL, %d mapping entries",
                            installed.size(), mappingTable.size()));

            CollationResolver resolver = new CollationResolver(mappingTable, installed);

            int processed = 0;
            for (TableDefinition table : tables) {
                checkCancellation();
                int percentage = 10 + (processed * 80 / tables.size());
                updateProgress(progressCallback, percentage, "Applying collations: " + table.getTargetQualifiedName(),
                        String.format("Table %d of %d", processed + 1, tables.size()));

                applyCollations(connection, table, resolver, result);
                processed++;
            }
        } catch (SQLException e) {
            throw new ConnectivityException("PostgreSQL", "Collation migration failed: " + e.getMessage(), e);
        }

        return result;
    }

    Set<String> loadInstalledCollations(Connection connection) throws SQLException {
        Set<String> collations = new HashSet<>();
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT collname FROM pg_collation WHERE collname <> ''");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                collations.add(rs.getString("collname"));
            }
        }
        log.debug("Found {} installed PostgreSQL collations", collations.size());
        return collations;
    }

    private void applyCollations(Connection connection, TableDefinition table, CollationResolver resolver,
                                 CollationMigrationResult result) {
        for (ColumnMapping column : table.getColumns()) {
            String sourceCollation = column.getSourceColumn().getCollation();
            if (sourceCollation == null || !TypeCategory.classify(column.getTargetType()).isCollatable()) {
                continue;
            }

            String columnName = table.getTargetQualifiedName() + "." + column.getTargetName();
            String targetCollation;
            try {
                targetCollation = resolver.resolve(sourceCollation);
            } catch (CollationUnresolvedException e) {
                log.warn("Collation of {} left unchanged: {}", columnName, e.getMessage());
                result.addUnresolved(columnName, sourceCollation, e.getMessage());
                continue;
            }

            if (CollationMappingTable.isFallbackMarker(targetCollation)) {
                log.debug("Keeping database default collation for {} ({})", columnName, sourceCollation);
                result.addKeptDefault(columnName, sourceCollation);
                continue;
            }

            String sql = generateAlterSql(table, column, targetCollation);
            try {
                ddlLockRegistry.withSchemaLock(table.getTargetSchema(), () -> execute(connection, sql));
                result.addApplied(columnName, sourceCollation, targetCollation);
                log.info("Collation of {} set to {} (source {})", columnName, targetCollation, sourceCollation);
            } catch (SQLException e) {
                String message = String.format("Failed to set collation %s: %s", targetCollation, e.getMessage());
                result.addError(columnName, sourceCollation, targetCollation, message);
                log.error("{} on {}", message, columnName);
                log.error("Failed SQL statement: {}", sql);
            }
        }
    }

    static String generateAlterSql(TableDefinition table, ColumnMapping column, String targetCollation) {
        return "ALTER TABLE " + PostgresIdentifierNormalizer.quoteQualified(table.getTargetSchema(), table.getTargetTableName())
                + " ALTER COLUMN " + PostgresIdentifierNormalizer.quote(column.getTargetName())
                + " TYPE " + column.getTargetType()
                + " COLLATE " + PostgresIdentifierNormalizer.quote(targetCollation);
    }

    private void execute(Connection connection, String sql) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
        } catch (SQLException e) {
            rollbackQuietly(connection);
            throw e;
        }
    }

    private void rollbackQuietly(Connection connection) {
        try {
            if (!connection.getAutoCommit()) {
                connection.rollback();
            }
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    @Override
    protected String generateSummaryMessage(CollationMigrationResult result) {
        if (result.isSkipped()) {
            return "Collation migration skipped";
        }
        return String.format("Collation migration completed: %d applied, %d kept default, %d unresolved, %d errors",
                result.getAppliedCount(), result.getKeptDefaultCount(), result.getUnresolvedCount(),
                result.getErrorCount());
    }
}
