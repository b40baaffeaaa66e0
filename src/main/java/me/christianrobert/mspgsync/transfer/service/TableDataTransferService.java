package me.christianrobert.mspgsync.transfer.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.exception.ConnectivityException;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.core.job.model.transfer.DataTransferResult;
import me.christianrobert.mspgsync.core.tools.PostgresIdentifierNormalizer;
import me.christianrobert.mspgsync.database.service.PostgresConnectionService;
import me.christianrobert.mspgsync.database.service.SqlServerConnectionService;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.LongConsumer;
import java.util.stream.Collectors;

/**
 * Copies the rows of one table from SQL Server to PostgreSQL.
 *
 * <p>Rows are read with a forward-only cursor and written in batches of
 * {@code migration.batch-size} rows, each batch one COPY and one commit. A failure mid-table
 * therefore leaves only complete batches behind. A batch failing with a connection error is
 * retried on a fresh target connection up to {@code migration.max-retries} times with
 * exponential backoff, and so is opening the source cursor; any other failure, or running out of
 * retries, marks the table FAILED.
 * Cancellation is checked after every committed batch.</p>
 */
@ApplicationScoped
public class TableDataTransferService {

    private static final Logger log = LoggerFactory.getLogger(TableDataTransferService.class);

    static final String NULL_MARKER = "\\N";

    // Non-null values are always quoted so a literal "\N" string is never read as NULL
    static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setNullString(NULL_MARKER)
            .setQuoteMode(QuoteMode.ALL_NON_NULL)
            .setRecordSeparator("\n")
            .build();

    @Inject
    SqlServerConnectionService sqlServerConnectionService;

    @Inject
    PostgresConnectionService postgresConnectionService;

    @Inject
    PostgresCopyWriter copyWriter;

    @Inject
    ConfigService configService;

    /**
     * Transfers one table and records its outcome in {@code result}.
     *
     * @param cancellationRequested polled between batches
     * @param rowsCommitted         called with the running total after each committed batch
     */
    public void transferTable(TableDefinition table, DataTransferResult result,
                              BooleanSupplier cancellationRequested, LongConsumer rowsCommitted) {
        String tableName = table.getTargetQualifiedName();
        if (table.getColumns().isEmpty()) {
            result.addSkippedTable(tableName, "No mapped columns");
            log.warn("Skipping data transfer for {}: no mapped columns", tableName);
            return;
        }

        int batchSize = Math.max(1, configService.getConfigValueAsInt(ConfigService.BATCH_SIZE, 1000));
        String selectSql = buildSelectSql(table);
        String copySql = buildCopySql(table);
        log.debug("Transfer {}: {} -> {}", tableName, selectSql, copySql);

        BatchWriter writer = new BatchWriter(tableName, copySql);
        long committed = 0;

        try (SourceCursor cursor = openSourceCursor(tableName, selectSql, batchSize)) {
            writer.truncate(table);

            ResultSet rs = cursor.getRows();
            List<List<String>> batch = new ArrayList<>(batchSize);
            boolean more = true;
            while (more) {
                more = rs.next();
                if (more) {
                    batch.add(readRow(rs, table.getColumns()));
                }
                if (batch.size() >= batchSize || (!more && !batch.isEmpty())) {
                    committed += writer.write(batch);
                    batch.clear();
                    rowsCommitted.accept(committed);

                    if (cancellationRequested.getAsBoolean()) {
                        result.addCancelledTable(tableName, committed);
                        log.info("Transfer of {} cancelled after {} committed rows", tableName, committed);
                        return;
                    }
                }
            }

            writer.resetIdentitySequences(table);
            result.addTransferredTable(tableName, committed);
            log.info("Transferred {} rows into {}", committed, tableName);

        } catch (SQLException | IOException | ConnectivityException e) {
            String message = String.format("Data transfer failed for %s after %d committed rows: %s",
                    tableName, committed, e.getMessage());
            result.addError(tableName, committed, message);
            log.error(message);
        } finally {
            writer.close();
        }
    }

    /**
     * Opens the source cursor. A connection error before the first row is read is retried like a
     * target batch; once rows are streaming a failure fails the table.
     */
    private SourceCursor openSourceCursor(String tableName, String selectSql, int batchSize) throws SQLException {
        int maxRetries = maxRetries();
        for (int attempt = 0; ; attempt++) {
            Connection connection = null;
            PreparedStatement select = null;
            try {
                connection = sqlServerConnectionService.getConnection();
                select = connection.prepareStatement(selectSql, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
                select.setFetchSize(batchSize);
                return new SourceCursor(connection, select, select.executeQuery());
            } catch (SQLException e) {
                closeSource(tableName, select, connection);
                if (!ConnectivityException.isTransient(e) || attempt >= maxRetries) {
                    throw e;
                }
                long delay = retryDelay(attempt);
                log.warn("Connection error reading {} from SQL Server (attempt {} of {}), retrying in {} ms: {}",
                        tableName, attempt + 1, maxRetries + 1, delay, e.getMessage());
                sleep(delay);
            }
        }
    }

    private static void closeSource(String tableName, PreparedStatement select, Connection connection) {
        try {
            if (select != null) {
                select.close();
            }
            if (connection != null) {
                connection.close();
            }
        } catch (SQLException e) {
            log.debug("Closing failed source connection for {} failed: {}", tableName, e.getMessage());
        }
    }

    private int maxRetries() {
        return Math.max(0, configService.getConfigValueAsInt(ConfigService.MAX_RETRIES, 3));
    }

    private long retryDelay(int attempt) {
        long backoff = Math.max(0, configService.getConfigValueAsInt(ConfigService.RETRY_BACKOFF_MS, 500));
        return backoff * (1L << attempt);
    }

    private static void sleep(long millis) throws SQLException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting to retry", e);
        }
    }

    private List<String> readRow(ResultSet rs, List<ColumnMapping> columns) throws SQLException {
        List<String> row = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            row.add(ColumnValueConverter.format(ColumnValueConverter.read(rs, i + 1, columns.get(i))));
        }
        return row;
    }

    static String buildSelectSql(TableDefinition table) {
        TableMetadata source = table.getSourceTable();
        String columns = table.getColumns().stream()
                .map(c -> bracket(c.getSourceName()))
                .collect(Collectors.joining(", "));
        return "SELECT " + columns + " FROM " + bracket(source.getSchema()) + "." + bracket(source.getTableName());
    }

    static String buildCopySql(TableDefinition table) {
        String columns = table.getColumns().stream()
                .map(c -> PostgresIdentifierNormalizer.quote(c.getTargetName()))
                .collect(Collectors.joining(", "));
        return "COPY " + PostgresIdentifierNormalizer.quoteQualified(table.getTargetSchema(), table.getTargetTableName())
                + " (" + columns + ") FROM STDIN WITH (FORMAT csv, NULL '\\N', ENCODING 'UTF8')";
    }

    static String toCsv(List<List<String>> rows) throws IOException {
        StringWriter writer = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(writer, CSV_FORMAT)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        }
        return writer.toString();
    }

    private static String bracket(String identifier) {
        return "[" + identifier.replace("]", "]]") + "]";
    }

    /**
     * Owns the target connection of one table transfer and replaces it after a connection error.
     */
    private class BatchWriter implements AutoCloseable {

        private final String tableName;
        private final String copySql;
        private Connection connection;

        BatchWriter(String tableName, String copySql) {
            this.tableName = tableName;
            this.copySql = copySql;
        }

        void truncate(TableDefinition table) throws SQLException, IOException {
            String sql = "TRUNCATE TABLE " + PostgresIdentifierNormalizer.quoteQualified(
                    table.getTargetSchema(), table.getTargetTableName());
            withRetry("truncate", conn -> {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute(sql);
                }
                return 0L;
            });
        }

        long write(List<List<String>> rows) throws SQLException, IOException {
            String csv = toCsv(rows);
            return withRetry("batch of " + rows.size() + " rows", conn -> copyWriter.copyIn(conn, copySql, csv));
        }

        void resetIdentitySequences(TableDefinition table) throws SQLException, IOException {
            String qualified = PostgresIdentifierNormalizer.quoteQualified(
                    table.getTargetSchema(), table.getTargetTableName());
            for (ColumnMapping column : table.getColumns()) {
                if (!column.getSourceColumn().isIdentity()) {
                    continue;
                }
                String sql = "SELECT setval(pg_get_serial_sequence(?, ?), MAX(" + PostgresIdentifierNormalizer.quote(
                        column.getTargetName()) + ")) FROM " + qualified + " HAVING MAX("
                        + PostgresIdentifierNormalizer.quote(column.getTargetName()) + ") IS NOT NULL";
                withRetry("identity reset", conn -> {
                    try (PreparedStatement ps = conn.prepareStatement(sql)) {
                        ps.setString(1, qualified);
                        ps.setString(2, column.getTargetName());
                        ps.execute();
                    }
                    return 0L;
                });
                log.debug("Identity sequence of {}.{} reset", tableName, column.getTargetName());
            }
        }

        private long withRetry(String operation, TargetAction action) throws SQLException, IOException {
            int maxRetries = maxRetries();

            for (int attempt = 0; ; attempt++) {
                try {
                    Connection conn = connection();
                    long rows = action.apply(conn);
                    conn.commit();
                    return rows;
                } catch (SQLException e) {
                    rollback();
                    if (!ConnectivityException.isTransient(e) || attempt >= maxRetries) {
                        throw e;
                    }
                    long delay = retryDelay(attempt);
                    log.warn("Connection error during {} of {} (attempt {} of {}), retrying in {} ms: {}",
                            operation, tableName, attempt + 1, maxRetries + 1, delay, e.getMessage());
                    discardConnection();
                    sleep(delay);
                }
            }
        }

        private Connection connection() throws SQLException {
            if (connection == null || connection.isClosed()) {
                connection = postgresConnectionService.getConnection();
                connection.setAutoCommit(false);
            }
            return connection;
        }

        private void rollback() {
            if (connection == null) {
                return;
            }
            try {
                if (!connection.isClosed()) {
                    connection.rollback();
                }
            } catch (SQLException e) {
                log.debug("Rollback on {} failed: {}", tableName, e.getMessage());
            }
        }

        private void discardConnection() {
            if (connection != null) {
                try {
                    connection.close();
                } catch (SQLException e) {
                    log.debug("Closing broken connection for {} failed: {}", tableName, e.getMessage());
                }
                connection = null;
            }
        }

        @Override
        public void close() {
            discardConnection();
        }
    }

    /**
     * Source connection, statement and open result set of one table transfer.
     */
    private static final class SourceCursor implements AutoCloseable {

        private final Connection connection;
        private final PreparedStatement statement;
        private final ResultSet rows;

        SourceCursor(Connection connection, PreparedStatement statement, ResultSet rows) {
            this.connection = connection;
            this.statement = statement;
            this.rows = rows;
        }

        ResultSet getRows() {
            return rows;
        }

        @Override
        public void close() throws SQLException {
            try {
                rows.close();
                statement.close();
            } finally {
                connection.close();
            }
        }
    }

    @FunctionalInterface
    private interface TargetAction {
        long apply(Connection connection) throws SQLException, IOException;
    }
}
