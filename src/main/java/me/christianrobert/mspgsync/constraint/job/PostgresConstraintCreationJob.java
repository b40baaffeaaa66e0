package me.christianrobert.mspgsync.constraint.job;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.constraint.service.ConstraintDependencyAnalyzer;
import me.christianrobert.mspgsync.constraint.service.ConstraintDependencyAnalyzer.TableConstraintPair;
import me.christianrobert.mspgsync.constraint.service.ConstraintSqlBuilder;
import me.christianrobert.mspgsync.core.exception.ConnectivityException;
import me.christianrobert.mspgsync.core.exception.ScriptConversionException;
import me.christianrobert.mspgsync.core.job.AbstractDatabaseWriteJob;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintCreationResult;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintMetadata;
import me.christianrobert.mspgsync.core.job.model.table.IndexMetadata;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.core.tools.DdlLockRegistry;
import me.christianrobert.mspgsync.core.tools.PostgresIdentifierNormalizer;
import me.christianrobert.mspgsync.database.service.PostgresConnectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;
import java.util.function.Consumer;

/**
 * Creates constraints and indexes in PostgreSQL for the tables created in step 1.
 *
 * Creation Order:
 * 1. Primary Keys
 * 2. Unique Constraints
 * 3. Foreign Keys (topologically sorted by table dependencies)
 * 4. Check Constraints
 * 5. Indexes, including filtered indexes as partial indexes
 *
 * Every statement runs on its own; a failing statement is recorded and the job continues.
 * A foreign key cycle between tables fails the whole step before anything is executed.
 * This job is meant to be run AFTER data transfer.
 */
@Dependent
public class PostgresConstraintCreationJob extends AbstractDatabaseWriteJob<ConstraintCreationResult> {

    private static final Logger log = LoggerFactory.getLogger(PostgresConstraintCreationJob.class);

    static final String INDEX_TYPE = "I";

    private static final String EXISTING_CONSTRAINTS_SQL = """
            SELECT
                n.nspname AS schema_name,
                c.relname AS table_name,
                con.conname AS constraint_name
            FROM pg_constraint con
            JOIN pg_class c ON con.conrelid = c.oid
            JOIN pg_namespace n ON c.relnamespace = n.oid
            WHERE n.nspname NOT IN ('information_schema', 'pg_catalog', 'pg_toast')
            UNION ALL
            SELECT schemaname, tablename, indexname
            FROM pg_indexes
            WHERE schemaname NOT IN ('information_schema', 'pg_catalog', 'pg_toast')
            """;

    private static final String EXISTING_TABLES_SQL = """
            SELECT table_schema, table_name
            FROM information_schema.tables
            WHERE table_schema NOT IN ('information_schema', 'pg_catalog')
              AND table_type = 'BASE TABLE'
            """;

    @Inject
    PostgresConnectionService postgresConnectionService;

    @Inject
    DdlLockRegistry ddlLockRegistry;

    @Override
    public String getTargetDatabase() {
        return "POSTGRES";
    }

    @Override
    public String getWriteOperationType() {
        return "CONSTRAINT_CREATION";
    }

    @Override
    public Class<ConstraintCreationResult> getResultType() {
        return ConstraintCreationResult.class;
    }

    @Override
    protected void saveResultsToState(ConstraintCreationResult result) {
        stateService.setConstraintCreationResult(result);
    }

    @Override
    protected ConstraintCreationResult performWriteOperation(Consumer<JobProgress> progressCallback) throws Exception {
        updateProgress(progressCallback, 0, "Initializing", "Starting PostgreSQL constraint creation process");

        ConstraintCreationResult result = new ConstraintCreationResult();
        List<TableDefinition> definitions = stateService.getTableDefinitions();
        if (definitions.isEmpty()) {
            updateProgress(progressCallback, 100, "No tables to process",
                    "No table definitions found in state. Run table creation first.");
            log.warn("No table definitions found in state for constraint creation");
            return result;
        }

        Map<String, TableDefinition> definitionsBySource = new HashMap<>();
        List<TableMetadata> sourceTables = new ArrayList<>();
        for (TableDefinition definition : definitions) {
            definitionsBySource.put(sourceKey(definition.getSourceTable().getQualifiedName()), definition);
            sourceTables.add(definition.getSourceTable());
        }

        updateProgress(progressCallback, 10, "Analyzing constraints",
                String.format("Sorting constraints of %d tables by dependency", sourceTables.size()));

        // Throws CyclicConstraintException before any statement is issued
        List<TableConstraintPair> sortedConstraints = ConstraintDependencyAnalyzer.sortConstraintsByDependency(sourceTables);
        ConstraintSqlBuilder sqlBuilder = new ConstraintSqlBuilder(configService.isEnabled(ConfigService.NORMALIZE_NAMES));

        updateProgress(progressCallback, 20, "Connecting to PostgreSQL",
                String.format("Will create %d constraints in dependency order", sortedConstraints.size()));

        try (Connection postgresConnection = postgresConnectionService.getConnection()) {
            postgresConnection.setAutoCommit(true);
            Map<String, Set<String>> existing = getExistingPostgresConstraints(postgresConnection);
            Set<String> existingTables = getExistingPostgresTables(postgresConnection);

            updateProgress(progressCallback, 30, "Checking existing constraints",
                    String.format("Found existing constraints on %d tables", existing.size()));

            createConstraints(postgresConnection, sortedConstraints, definitionsBySource, existing, existingTables,
                    sqlBuilder, result, progressCallback);
            createIndexes(postgresConnection, definitions, existing, sqlBuilder, result, progressCallback);

            updateProgress(progressCallback, 90, "Creation complete",
                    String.format("Created %d constraints, skipped %d existing, %d errors",
                            result.getCreatedCount(), result.getSkippedCount(), result.getErrorCount()));
            return result;
        } catch (SQLException e) {
            updateProgress(progressCallback, -1, "Failed", "Constraint creation failed: " + e.getMessage());
            throw new ConnectivityException("POSTGRES", "Constraint creation failed: " + e.getMessage(), e);
        }
    }

    private void createConstraints(Connection connection, List<TableConstraintPair> sortedConstraints,
                                   Map<String, TableDefinition> definitionsBySource,
                                   Map<String, Set<String>> existingConstraints, Set<String> existingTables,
                                   ConstraintSqlBuilder sqlBuilder, ConstraintCreationResult result,
                                   Consumer<JobProgress> progressCallback) throws SQLException {
        int totalConstraints = sortedConstraints.size();
        int processedConstraints = 0;

        for (TableConstraintPair pair : sortedConstraints) {
            if (isCancellationRequested()) {
                log.info("Constraint creation cancelled after {} of {} constraints", processedConstraints, totalConstraints);
                return;
            }
            int progressPercentage = 30 + (processedConstraints * 40 / Math.max(1, totalConstraints));
            processedConstraints++;

            ConstraintMetadata constraint = pair.constraint;
            TableDefinition definition = definitionsBySource.get(sourceKey(pair.getQualifiedTableName()));
            String qualifiedTableName = definition.getTargetQualifiedName();
            String constraintName = sqlBuilder.targetConstraintName(definition, constraint.getConstraintName());
            String constraintType = constraint.getConstraintType();

            updateProgress(progressCallback, progressPercentage,
                    String.format("Creating %s constraint: %s on %s",
                            constraint.getConstraintTypeDisplay(), constraintName, qualifiedTableName),
                    String.format("Constraint %d of %d", processedConstraints, totalConstraints));

            if (exists(existingConstraints, definition, constraintName)) {
                result.addSkippedConstraint(qualifiedTableName, constraintName, constraintType,
                        "Constraint already exists");
                log.info("Constraint '{}' already exists on table '{}', skipping", constraintName, qualifiedTableName);
                continue;
            }

            TableDefinition referenced = null;
            if (constraint.isForeignKey()) {
                referenced = definitionsBySource.get(sourceKey(constraint.getReferencedQualifiedName()));
                String referencedTarget = referencedTargetName(constraint, referenced, sqlBuilder);
                if (!existingTables.contains(referencedTarget)) {
                    result.addSkippedConstraint(qualifiedTableName, constraintName, constraintType,
                            "Referenced table " + referencedTarget + " does not exist");
                    log.warn("Skipping foreign key '{}' on '{}': referenced table {} does not exist",
                            constraintName, qualifiedTableName, referencedTarget);
                    continue;
                }
            }

            String sql = null;
            try {
                sql = generateConstraintSql(sqlBuilder, definition, constraint, referenced);
                execute(connection, definition.getTargetSchema(), sql, result);
                result.addCreatedConstraint(qualifiedTableName, constraintName, constraintType);
                log.info("Created {} constraint '{}' on table '{}'",
                        constraint.getConstraintTypeDisplay(), constraintName, qualifiedTableName);
            } catch (SQLException | IllegalArgumentException | ScriptConversionException e) {
                if (e instanceof SQLException && ConnectivityException.isTransient((SQLException) e)) {
                    throw (SQLException) e;
                }
                String errorMessage = String.format("Failed to create %s constraint '%s' on table '%s': %s",
                        constraint.getConstraintTypeDisplay(), constraintName, qualifiedTableName, e.getMessage());
                result.addError(qualifiedTableName, constraintName, constraintType, errorMessage, sql);
                log.error("Failed to create constraint '{}' on table '{}': {}",
                        constraintName, qualifiedTableName, e.getMessage());
                log.error("Failed SQL statement: {}", sql);
            }
        }
    }

    private void createIndexes(Connection connection, List<TableDefinition> definitions,
                               Map<String, Set<String>> existingConstraints, ConstraintSqlBuilder sqlBuilder,
                               ConstraintCreationResult result, Consumer<JobProgress> progressCallback) throws SQLException {
        List<TableDefinition> ordered = new ArrayList<>(definitions);
        ordered.sort(Comparator.comparing(TableDefinition::getTargetQualifiedName));

        int processedTables = 0;
        for (TableDefinition definition : ordered) {
            if (isCancellationRequested()) {
                log.info("Index creation cancelled");
                return;
            }
            processedTables++;
            List<IndexMetadata> indexes = new ArrayList<>(definition.getSourceTable().getIndexes());
            if (indexes.isEmpty()) {
                continue;
            }
            indexes.sort(Comparator.comparing(IndexMetadata::getIndexName));
            updateProgress(progressCallback, 70 + (processedTables * 20 / ordered.size()),
                    "Creating indexes on " + definition.getTargetQualifiedName(),
                    String.format("%d indexes", indexes.size()));

            for (IndexMetadata index : indexes) {
                String qualifiedTableName = definition.getTargetQualifiedName();
                String indexName = sqlBuilder.targetConstraintName(definition, index.getIndexName());
                if (exists(existingConstraints, definition, indexName)) {
                    result.addSkippedConstraint(qualifiedTableName, indexName, INDEX_TYPE, "Index already exists");
                    log.info("Index '{}' already exists on table '{}', skipping", indexName, qualifiedTableName);
                    continue;
                }

                String sql = null;
                try {
                    sql = sqlBuilder.indexSql(definition, index);
                    execute(connection, definition.getTargetSchema(), sql, result);
                    result.addCreatedConstraint(qualifiedTableName, indexName, INDEX_TYPE);
                    log.info("Created {}index '{}' on table '{}'", index.isFiltered() ? "partial " : "",
                            indexName, qualifiedTableName);
                } catch (SQLException | IllegalArgumentException | ScriptConversionException e) {
                    if (e instanceof SQLException && ConnectivityException.isTransient((SQLException) e)) {
                        throw (SQLException) e;
                    }
                    result.addError(qualifiedTableName, indexName, INDEX_TYPE,
                            String.format("Failed to create index '%s' on table '%s': %s",
                                    indexName, qualifiedTableName, e.getMessage()), sql);
                    log.error("Failed to create index '{}' on table '{}': {}", indexName, qualifiedTableName, e.getMessage());
                    log.error("Failed SQL statement: {}", sql);
                }
            }
        }
    }

    private void execute(Connection connection, String schema, String sql, ConstraintCreationResult result) throws SQLException {
        result.addEmittedStatement(sql);
        ddlLockRegistry.withSchemaLock(schema, () -> {
            try (PreparedStatement stmt = connection.prepareStatement(sql)) {
                stmt.executeUpdate();
            }
        });
        log.debug("Executed SQL: {}", sql);
    }

    static String generateConstraintSql(ConstraintSqlBuilder sqlBuilder, TableDefinition definition,
                                        ConstraintMetadata constraint, TableDefinition referenced) {
        if (constraint.isPrimaryKey()) {
            return sqlBuilder.primaryKeySql(definition, constraint);
        } else if (constraint.isUniqueConstraint()) {
            return sqlBuilder.uniqueSql(definition, constraint);
        } else if (constraint.isForeignKey()) {
            return sqlBuilder.foreignKeySql(definition, constraint, referenced);
        } else if (constraint.isCheckConstraint()) {
            if (constraint.getCheckCondition() == null || constraint.getCheckCondition().isBlank()) {
                throw new IllegalArgumentException(String.format("Check constraint '%s' has no condition",
                        constraint.getConstraintName()));
            }
            return sqlBuilder.checkSql(definition, constraint);
        }
        throw new IllegalArgumentException("Unknown constraint type: " + constraint.getConstraintType());
    }

    private String referencedTargetName(ConstraintMetadata constraint, TableDefinition referenced,
                                        ConstraintSqlBuilder sqlBuilder) {
        if (referenced != null) {
            return referenced.getTargetQualifiedName().toLowerCase(Locale.ROOT);
        }
        boolean lowercase = configService.isEnabled(ConfigService.NORMALIZE_NAMES);
        return (PostgresIdentifierNormalizer.normalizeSchema(constraint.getReferencedSchema(), lowercase) + "."
                + PostgresIdentifierNormalizer.normalizeName(constraint.getReferencedTable(), lowercase,
                constraint.getReferencedQualifiedName())).toLowerCase(Locale.ROOT);
    }

    private boolean exists(Map<String, Set<String>> existing, TableDefinition definition, String name) {
        Set<String> names = existing.get(definition.getTargetQualifiedName().toLowerCase(Locale.ROOT));
        return names != null && names.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Gets existing PostgreSQL constraints and indexes organized by table.
     * Returns a map: qualified_table_name -> Set of constraint_names, both lowercased
     */
    private Map<String, Set<String>> getExistingPostgresConstraints(Connection connection) throws SQLException {
        Map<String, Set<String>> constraints = new HashMap<>();
        try (PreparedStatement stmt = connection.prepareStatement(EXISTING_CONSTRAINTS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                String qualifiedTableName = (rs.getString(1) + "." + rs.getString(2)).toLowerCase(Locale.ROOT);
                constraints.computeIfAbsent(qualifiedTableName, k -> new HashSet<>())
                        .add(rs.getString(3).toLowerCase(Locale.ROOT));
            }
        }
        log.debug("Found existing constraints on {} PostgreSQL tables", constraints.size());
        return constraints;
    }

    private Set<String> getExistingPostgresTables(Connection connection) throws SQLException {
        Set<String> tables = new HashSet<>();
        try (PreparedStatement stmt = connection.prepareStatement(EXISTING_TABLES_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                tables.add((rs.getString(1) + "." + rs.getString(2)).toLowerCase(Locale.ROOT));
            }
        }
        return tables;
    }

    private static String sourceKey(String qualifiedName) {
        return qualifiedName.toLowerCase(Locale.ROOT);
    }

    @Override
    protected String generateSummaryMessage(ConstraintCreationResult result) {
        return String.format("Constraint creation completed: %d created, %d skipped, %d errors",
                result.getCreatedCount(), result.getSkippedCount(), result.getErrorCount());
    }
}
