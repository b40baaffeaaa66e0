package me.christianrobert.mspgsync.verification.job;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.exception.ConnectivityException;
import me.christianrobert.mspgsync.core.job.AbstractDatabaseWriteJob;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMetadata;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.core.job.model.verification.VerificationReport;
import me.christianrobert.mspgsync.core.job.model.verification.VerificationReport.ColumnStatus;
import me.christianrobert.mspgsync.core.job.model.verification.VerificationReport.ColumnVerification;
import me.christianrobert.mspgsync.core.job.model.verification.VerificationReport.TableVerification;
import me.christianrobert.mspgsync.core.tools.JsonFileStore;
import me.christianrobert.mspgsync.core.tools.PostgresIdentifierNormalizer;
import me.christianrobert.mspgsync.core.tools.TypeCategory;
import me.christianrobert.mspgsync.database.service.PostgresConnectionService;
import me.christianrobert.mspgsync.database.service.SqlServerConnectionService;
import me.christianrobert.mspgsync.transfer.service.RowCountService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Step 2: compares every source table with its PostgreSQL counterpart and writes the column
 * mapping report. Read-only on both sides.
 *
 * Columns are compared by type category, not by exact type, since the type mapping table decides
 * the exact target type. Row counts are compared only when data migration is enabled.
 */
@Dependent
public class ColumnVerificationJob extends AbstractDatabaseWriteJob<VerificationReport> {

    private static final Logger log = LoggerFactory.getLogger(ColumnVerificationJob.class);

    static final String REPORT_FILE = "column-mapping-report.json";

    private static final DateTimeFormatter RUN_DIRECTORY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private static final String COLUMNS_SQL = """
            SELECT column_name, data_type, udt_name
            FROM information_schema.columns
            WHERE table_schema = ? AND table_name = ?
            ORDER BY ordinal_position
            """;

    @Inject
    PostgresConnectionService postgresConnectionService;

    @Inject
    SqlServerConnectionService sqlServerConnectionService;

    @Inject
    RowCountService rowCountService;

    @Override
    public String getTargetDatabase() {
        return "POSTGRES";
    }

    @Override
    public String getWriteOperationType() {
        return "COLUMN_VERIFICATION";
    }

    @Override
    public Class<VerificationReport> getResultType() {
        return VerificationReport.class;
    }

    @Override
    protected void saveResultsToState(VerificationReport result) {
        stateService.setVerificationReport(result);
    }

    @Override
    protected VerificationReport performWriteOperation(Consumer<JobProgress> progressCallback) throws Exception {
        updateProgress(progressCallback, 0, "Initializing", "Starting column verification");

        VerificationReport report = new VerificationReport();
        List<TableMetadata> sourceTables = stateService.getSourceTableMetadata();
        if (sourceTables.isEmpty()) {
            updateProgress(progressCallback, 100, "No tables to verify",
                    "No source tables found in state. Run table creation first.");
            log.warn("No source tables found in state for verification");
            return report;
        }

        Map<String, TableDefinition> definitions = new HashMap<>();
        for (TableDefinition definition : stateService.getTableDefinitions()) {
            definitions.put(definition.getSourceTable().getQualifiedName(), definition);
        }

        boolean compareRows = configService.isEnabled(ConfigService.MIGRATE_DATA);
        boolean lowercase = configService.isEnabled(ConfigService.NORMALIZE_NAMES);

        try (Connection postgres = postgresConnectionService.getConnection();
             Connection sqlServer = compareRows ? sqlServerConnectionService.getConnection() : null) {

            int processed = 0;
            for (TableMetadata source : sourceTables) {
                checkCancellation();
                updateProgress(progressCallback, 5 + (processed * 80 / sourceTables.size()),
                        "Verifying: " + source.getQualifiedName(),
                        String.format("Table %d of %d", processed + 1, sourceTables.size()));

                TableDefinition definition = definitions.get(source.getQualifiedName());
                report.addTable(verifyTable(postgres, sqlServer, source, definition, lowercase));
                processed++;
            }
        } catch (SQLException e) {
            throw new ConnectivityException("PostgreSQL", "Column verification failed: " + e.getMessage(), e);
        }

        writeReport(report);
        return report;
    }

    private TableVerification verifyTable(Connection postgres, Connection sqlServer, TableMetadata source,
                                          TableDefinition definition, boolean lowercase) {
        String targetSchema;
        String targetTable;
        if (definition != null) {
            targetSchema = definition.getTargetSchema();
            targetTable = definition.getTargetTableName();
        } else {
            targetSchema = PostgresIdentifierNormalizer.normalizeSchema(source.getSchema(), lowercase);
            targetTable = PostgresIdentifierNormalizer.normalizeName(source.getTableName(), lowercase,
                    source.getQualifiedName());
        }
        String targetName = targetSchema + "." + targetTable;

        Map<String, String> targetColumns;
        try {
            targetColumns = fetchTargetColumns(postgres, targetSchema, targetTable);
        } catch (SQLException e) {
            log.warn("Could not read columns of {}: {}", targetName, e.getMessage());
            return new TableVerification(source.getQualifiedName(), targetName, false,
                    source.getColumns().size(), 0, List.of(), null, null,
                    "Reading PostgreSQL columns failed: " + e.getMessage());
        }

        if (targetColumns.isEmpty()) {
            log.warn("Table {} missing in PostgreSQL", targetName);
            return new TableVerification(source.getQualifiedName(), targetName, false,
                    source.getColumns().size(), 0, List.of(), null, null, "Table missing in PostgreSQL");
        }

        List<ColumnVerification> columns = new ArrayList<>();
        for (ColumnMetadata sourceColumn : source.getColumns()) {
            ColumnMapping mapping = definition != null ? definition.findBySourceName(sourceColumn.getColumnName()) : null;
            columns.add(compareColumn(sourceColumn, mapping, targetColumns));
        }

        Long sourceRows = null;
        Long targetRows = null;
        if (sqlServer != null) {
            sourceRows = toNullable(rowCountService.countSourceRows(sqlServer, source.getSchema(), source.getTableName()));
            targetRows = toNullable(rowCountService.countTargetRows(postgres, targetSchema, targetTable));
        }

        TableVerification verification = new TableVerification(source.getQualifiedName(), targetName, true,
                source.getColumns().size(), targetColumns.size(), columns, sourceRows, targetRows, null);
        if (verification.isMatched()) {
            log.info("Table {} verified: {} columns matched", targetName, columns.size());
        } else {
            log.warn("Table {} differs from source {}", targetName, source.getQualifiedName());
        }
        return verification;
    }

    static ColumnVerification compareColumn(ColumnMetadata sourceColumn, ColumnMapping mapping,
                                            Map<String, String> targetColumns) {
        TypeCategory expected = expectedCategory(sourceColumn, mapping);
        String targetColumnName = mapping != null ? mapping.getTargetName() : null;
        String targetType = targetColumnName != null ? targetColumns.get(targetColumnName) : null;

        if (targetType == null) {
            return new ColumnVerification(sourceColumn.getColumnName(), sourceColumn.getTypeSignature(),
                    targetColumnName, null, expected.name(), null, ColumnStatus.MISSING);
        }

        TypeCategory actual = TypeCategory.classify(targetType);
        ColumnStatus status = expected == actual ? ColumnStatus.MATCHED : ColumnStatus.TYPE_MISMATCH;
        return new ColumnVerification(sourceColumn.getColumnName(), sourceColumn.getTypeSignature(),
                targetColumnName, targetType, expected.name(), actual.name(), status);
    }

    /**
     * Category of the source type; for source types without a common family the category of the
     * mapped target type. Identity columns are always created on an integer type, so a
     * decimal(18,0) identity expects INTEGER.
     */
    static TypeCategory expectedCategory(ColumnMetadata sourceColumn, ColumnMapping mapping) {
        if (sourceColumn.isIdentity()) {
            return TypeCategory.INTEGER;
        }
        TypeCategory category = TypeCategory.classify(sourceColumn.getDataType());
        if (category == TypeCategory.OTHER && mapping != null) {
            return TypeCategory.classify(mapping.getTargetType());
        }
        return category;
    }

    private Map<String, String> fetchTargetColumns(Connection postgres, String schema, String table) throws SQLException {
        Map<String, String> columns = new LinkedHashMap<>();
        try (PreparedStatement ps = postgres.prepareStatement(COLUMNS_SQL)) {
            ps.setString(1, schema);
            ps.setString(2, table);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String dataType = rs.getString("data_type");
                    if ("USER-DEFINED".equals(dataType) || "ARRAY".equals(dataType)) {
                        dataType = rs.getString("udt_name");
                    }
                    columns.put(rs.getString("column_name"), dataType);
                }
            }
        }
        return columns;
    }

    private static Long toNullable(long count) {
        return count < 0 ? null : count;
    }

    private void writeReport(VerificationReport report) {
        String base = configService.getConfigValueAsString(ConfigService.PATH_REPORTS);
        Path file = Paths.get(base != null ? base : "logs",
                "run_" + RUN_DIRECTORY_FORMAT.format(LocalDateTime.now()), REPORT_FILE);
        try {
            report.setReportPath(file.toAbsolutePath().toString());
            JsonFileStore.writeAtomically(file, report);
            log.info("Column mapping report written to {}", file.toAbsolutePath());
        } catch (IOException e) {
            report.setReportPath(null);
            log.warn("Could not write column mapping report to {}: {}", file, e.getMessage());
        }
    }

    @Override
    protected String generateSummaryMessage(VerificationReport result) {
        return String.format("Column verification completed: %d tables matched, %d differ",
                result.getMatchedTableCount(), result.getMismatchedTableCount());
    }
}
