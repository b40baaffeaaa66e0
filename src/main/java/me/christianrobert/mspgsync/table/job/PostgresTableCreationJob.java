package me.christianrobert.mspgsync.table.job;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.exception.ConnectivityException;
import me.christianrobert.mspgsync.core.job.AbstractDatabaseWriteJob;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.job.model.table.GenerationWarning;
import me.christianrobert.mspgsync.core.job.model.table.TableCreationResult;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.core.tools.DdlLockRegistry;
import me.christianrobert.mspgsync.core.tools.PostgresIdentifierNormalizer;
import me.christianrobert.mspgsync.database.service.PostgresConnectionService;
import me.christianrobert.mspgsync.schema.service.SqlServerSchemaIntrospector;
import me.christianrobert.mspgsync.table.service.PostgresDdlGenerator;
import me.christianrobert.mspgsync.typemapping.service.TypeMappingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Step 1 (first half): introspects SQL Server and creates the tables in PostgreSQL.
 *
 * Tables are created without constraints; those are added in step 3 once the data is loaded.
 * An existing target table is never dropped: depending on {@code migration.existing-table-mode}
 * it is kept and reused (SKIP) or recorded as a failure (FAIL).
 */
@Dependent
public class PostgresTableCreationJob extends AbstractDatabaseWriteJob<TableCreationResult> {

    private static final Logger log = LoggerFactory.getLogger(PostgresTableCreationJob.class);

    static final String MODE_SKIP = "SKIP";
    static final String MODE_FAIL = "FAIL";

    @Inject
    PostgresConnectionService postgresConnectionService;

    @Inject
    SqlServerSchemaIntrospector schemaIntrospector;

    @Inject
    TypeMappingService typeMappingService;

    @Inject
    DdlLockRegistry ddlLockRegistry;

    @Override
    public String getTargetDatabase() {
        return "POSTGRES";
    }

    @Override
    public String getWriteOperationType() {
        return "TABLE_CREATION";
    }

    @Override
    public Class<TableCreationResult> getResultType() {
        return TableCreationResult.class;
    }

    @Override
    protected void saveResultsToState(TableCreationResult result) {
        stateService.setTableCreationResult(result);
    }

    @Override
    protected TableCreationResult performWriteOperation(Consumer<JobProgress> progressCallback) throws Exception {
        updateProgress(progressCallback, 0, "Initializing", "Reading SQL Server schema");

        List<TableMetadata> sourceTables = schemaIntrospector.introspect();
        stateService.setSourceTableMetadata(sourceTables);

        TableCreationResult result = new TableCreationResult();
        if (sourceTables.isEmpty()) {
            updateProgress(progressCallback, 100, "No tables to process", "No SQL Server tables found");
            log.warn("No SQL Server tables found for table creation");
            return result;
        }

        PostgresDdlGenerator generator = new PostgresDdlGenerator(
                typeMappingService.snapshot(),
                configService.isEnabled(ConfigService.IDENTITY_ALWAYS),
                configService.isEnabled(ConfigService.NORMALIZE_NAMES));
        String existingTableMode = getExistingTableMode();

        updateProgress(progressCallback, 20, "Connecting to PostgreSQL",
                String.format("Found %d SQL Server tables", sourceTables.size()));

        try (Connection connection = postgresConnectionService.getConnection()) {
            Set<String> existingTables = getExistingPostgresTables(connection);
            Set<String> createdSchemas = new HashSet<>();

            updateProgress(progressCallback, 30, "Checking existing tables",
                    String.format("Found %d existing PostgreSQL tables", existingTables.size()));

            int processed = 0;
            for (TableMetadata table : sourceTables) {
                checkCancellation();

                int percentage = 30 + (processed * 60 / sourceTables.size());
                updateProgress(progressCallback, percentage, "Creating table: " + table.getQualifiedName(),
                        String.format("Table %d of %d", processed + 1, sourceTables.size()));

                TableDefinition definition = generator.generateCreateTable(table);
                for (GenerationWarning warning : definition.getWarnings()) {
                    result.addColumnWarning(table.getQualifiedName(), warning.getColumnName(), warning.getMessage());
                }

                if (existingTables.contains(definition.getTargetQualifiedName())) {
                    handleExistingTable(definition, existingTableMode, result);
                } else {
                    createTable(connection, definition, createdSchemas, result);
                }
                processed++;
            }
        } catch (SQLException e) {
            throw new ConnectivityException("PostgreSQL", "Table creation failed: " + e.getMessage(), e);
        }

        return result;
    }

    private String getExistingTableMode() {
        String mode = configService.getConfigValueAsString(ConfigService.EXISTING_TABLE_MODE);
        String normalized = mode == null ? MODE_SKIP : mode.trim().toUpperCase(Locale.ROOT);
        if (!MODE_SKIP.equals(normalized) && !MODE_FAIL.equals(normalized)) {
            log.warn("Unknown existing table mode '{}', using {}", mode, MODE_SKIP);
            return MODE_SKIP;
        }
        return normalized;
    }

    private void handleExistingTable(TableDefinition definition, String mode, TableCreationResult result) {
        String qualifiedName = definition.getTargetQualifiedName();
        if (MODE_FAIL.equals(mode)) {
            result.addError(qualifiedName, "Table already exists in PostgreSQL", null);
            log.error("Table '{}' already exists in PostgreSQL", qualifiedName);
            return;
        }
        result.addSkippedTable(qualifiedName);
        result.addTableDefinition(definition);
        log.info("Table '{}' already exists in PostgreSQL, skipping creation", qualifiedName);
    }

    private void createTable(Connection connection, TableDefinition definition, Set<String> createdSchemas,
                             TableCreationResult result) throws SQLException {
        String qualifiedName = definition.getTargetQualifiedName();
        try {
            ddlLockRegistry.withSchemaLock(definition.getTargetSchema(), () -> {
                if (!"public".equals(definition.getTargetSchema()) && createdSchemas.add(definition.getTargetSchema())) {
                    execute(connection, "CREATE SCHEMA IF NOT EXISTS "
                            + PostgresIdentifierNormalizer.quote(definition.getTargetSchema()));
                }
                execute(connection, definition.getCreateTableSql());
            });
            result.addCreatedTable(qualifiedName);
            result.addTableDefinition(definition);
            log.info("Created table '{}' ({} columns)", qualifiedName, definition.getColumns().size());
        } catch (SQLException e) {
            if (ConnectivityException.isTransient(e)) {
                throw e;
            }
            String errorMessage = String.format("Failed to create table '%s': %s", qualifiedName, e.getMessage());
            result.addError(qualifiedName, errorMessage, definition.getCreateTableSql());
            log.error(errorMessage);
            log.error("Failed SQL statement: {}", definition.getCreateTableSql());
        }
    }

    private void execute(Connection connection, String sql) throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(sql);
        }
        log.debug("Executed SQL: {}", sql);
    }

    Set<String> getExistingPostgresTables(Connection connection) throws SQLException {
        Set<String> tables = new HashSet<>();

        String sql = """
            SELECT schemaname AS schema_name, tablename AS table_name
            FROM pg_tables
            WHERE schemaname NOT IN ('information_schema', 'pg_catalog', 'pg_toast')
            """;

        try (PreparedStatement stmt = connection.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                tables.add(rs.getString("schema_name") + "." + rs.getString("table_name"));
            }
        }

        log.debug("Found {} existing PostgreSQL tables", tables.size());
        return tables;
    }

    @Override
    protected String generateSummaryMessage(TableCreationResult result) {
        return String.format("Table creation completed: %d created, %d skipped, %d errors, %d column warnings",
                result.getCreatedCount(), result.getSkippedCount(), result.getErrorCount(),
                result.getColumnWarningCount());
    }
}
