package me.christianrobert.mspgsync.transfer.service;

import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMetadata;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.core.job.model.transfer.DataTransferResult;
import me.christianrobert.mspgsync.database.service.PostgresConnectionService;
import me.christianrobert.mspgsync.database.service.SqlServerConnectionService;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class TableDataTransferServiceTest {

    private TableDataTransferService service;
    private SqlServerConnectionService sqlServerConnectionService;
    private PostgresConnectionService postgresConnectionService;
    private PostgresCopyWriter copyWriter;
    private ConfigService configService;

    private Connection source;
    private ResultSet sourceRows;

    @BeforeEach
    void setUp() throws Exception {
        sqlServerConnectionService = mock(SqlServerConnectionService.class);
        postgresConnectionService = mock(PostgresConnectionService.class);
        copyWriter = mock(PostgresCopyWriter.class);
        configService = new ConfigService(Map.of());
        configService.setConfigValue(ConfigService.BATCH_SIZE, 2);
        configService.setConfigValue(ConfigService.RETRY_BACKOFF_MS, 0);

        service = new TableDataTransferService();
        service.sqlServerConnectionService = sqlServerConnectionService;
        service.postgresConnectionService = postgresConnectionService;
        service.copyWriter = copyWriter;
        service.configService = configService;

        source = mock(Connection.class);
        PreparedStatement select = mock(PreparedStatement.class);
        sourceRows = mock(ResultSet.class);
        when(sqlServerConnectionService.getConnection()).thenReturn(source);
        when(source.prepareStatement(anyString(), anyInt(), anyInt())).thenReturn(select);
        when(select.executeQuery()).thenReturn(sourceRows);
        when(sourceRows.next()).thenReturn(true, true, true, false);
        when(sourceRows.getString(1)).thenReturn("a", "b", "c");
    }

    private Connection targetConnection() throws SQLException {
        Connection target = mock(Connection.class);
        when(target.createStatement()).thenReturn(mock(Statement.class));
        return target;
    }

    private static TableDefinition orders() {
        TableMetadata source = new TableMetadata("dbo", "Orders");
        ColumnMetadata id = new ColumnMetadata("Id", "int", null, 10, 0, false, true, 1, 1, null, 1, null);
        source.addColumn(id);
        return new TableDefinition(source, "public", "Orders",
                List.of(new ColumnMapping(id, "Id", "INTEGER")), "", List.of());
    }

    private static TableDefinition notes() {
        TableMetadata source = new TableMetadata("dbo", "Notes");
        ColumnMetadata text = new ColumnMetadata("Text", "nvarchar", 100, null, null, true, null, 1);
        source.addColumn(text);
        return new TableDefinition(source, "public", "Notes",
                List.of(new ColumnMapping(text, "Text", "VARCHAR(100)")), "", List.of());
    }

    // ========== CSV encoding ==========

    @Test
    void toCsv_roundTripsUuidTimestampAndLongText() throws Exception {
        String uuid = UUID.randomUUID().toString();
        String timestamp = ColumnValueConverter.format(LocalDateTime.of(2024, 5, 17, 8, 15, 0, 500000000));
        String longText = "x\"y,z\n".repeat(2000) + "end";
        assertTrue(longText.length() >= 10000);

        String csv = TableDataTransferService.toCsv(List.of(Arrays.asList(uuid, timestamp, longText, null)));

        try (CSVParser parser = CSVParser.parse(new StringReader(csv), TableDataTransferService.CSV_FORMAT)) {
            List<CSVRecord> records = parser.getRecords();
            assertEquals(1, records.size());
            assertEquals(uuid, records.get(0).get(0));
            assertEquals(timestamp, records.get(0).get(1));
            assertEquals(longText, records.get(0).get(2));
            assertNull(records.get(0).get(3));
        }
    }

    @Test
    void toCsv_nullIsUnquotedMarkerAndLiteralMarkerIsQuoted() throws Exception {
        String csv = TableDataTransferService.toCsv(List.of(Arrays.asList(null, "\\N")));

        assertEquals("\\N,\"\\N\"\n", csv);
    }

    @Test
    void buildSql_usesBracketsForSourceAndQuotesForTarget() {
        TableDefinition table = notes();

        assertEquals("SELECT [Text] FROM [dbo].[Notes]", TableDataTransferService.buildSelectSql(table));
        assertTrue(TableDataTransferService.buildCopySql(table)
                .startsWith("COPY \"public\".\"Notes\" (\"Text\") FROM STDIN WITH (FORMAT csv"));
    }

    // ========== Transfer ==========

    @Test
    void transferTable_writesBatchesAndCommitsEach() throws Exception {
        Connection target = targetConnection();
        when(postgresConnectionService.getConnection()).thenReturn(target);
        when(copyWriter.copyIn(any(), anyString(), anyString())).thenReturn(2L, 1L);

        DataTransferResult result = new DataTransferResult();
        List<Long> progress = new ArrayList<>();
        service.transferTable(notes(), result, () -> false, progress::add);

        assertEquals(List.of("public.Notes"), result.getTransferredTables());
        assertEquals(3, result.getTotalRowsTransferred());
        assertEquals(List.of(2L, 3L), progress);
        verify(copyWriter, times(2)).copyIn(eq(target), anyString(), anyString());
        // truncate plus two batches
        verify(target, times(3)).commit();
    }

    @Test
    void transferTable_retriesBatchAfterConnectionError() throws Exception {
        Connection broken = targetConnection();
        Connection fresh = targetConnection();
        when(postgresConnectionService.getConnection()).thenReturn(broken, fresh);
        when(copyWriter.copyIn(eq(broken), anyString(), anyString()))
                .thenThrow(new SQLException("connection reset", "08006"));
        when(copyWriter.copyIn(eq(fresh), anyString(), anyString())).thenReturn(2L, 1L);

        DataTransferResult result = new DataTransferResult();
        service.transferTable(notes(), result, () -> false, rows -> { });

        assertEquals(1, result.getTransferredCount());
        assertEquals(3, result.getTotalRowsTransferred());
        verify(broken).close();
    }

    @Test
    void transferTable_nonTransientErrorFailsTable() throws Exception {
        Connection target = targetConnection();
        when(postgresConnectionService.getConnection()).thenReturn(target);
        when(copyWriter.copyIn(any(), anyString(), anyString()))
                .thenThrow(new SQLException("invalid input syntax for type uuid", "22P02"));

        DataTransferResult result = new DataTransferResult();
        service.transferTable(notes(), result, () -> false, rows -> { });

        assertEquals(1, result.getErrorCount());
        assertTrue(result.getErrors().get(0).getMessage().contains("invalid input syntax"));
    }

    @Test
    void transferTable_cancellationKeepsCommittedBatches() throws Exception {
        Connection target = targetConnection();
        when(postgresConnectionService.getConnection()).thenReturn(target);
        when(copyWriter.copyIn(any(), anyString(), anyString())).thenReturn(2L);

        DataTransferResult result = new DataTransferResult();
        service.transferTable(notes(), result, () -> true, rows -> { });

        assertEquals(1, result.getCancelledCount());
        assertEquals(DataTransferResult.TableStatus.CANCELLED, result.getTables().get(0).getStatus());
        assertEquals(2, result.getTables().get(0).getRows());
        verify(copyWriter, times(1)).copyIn(any(), anyString(), anyString());
    }

    // ========== Truncate and identity reset ==========

    @Test
    void transferTable_truncatesBeforeLoadAndResetsIdentitySequence() throws Exception {
        Connection target = mock(Connection.class);
        Statement truncate = mock(Statement.class);
        PreparedStatement setval = mock(PreparedStatement.class);
        List<String> preparedSql = new ArrayList<>();
        when(target.createStatement()).thenReturn(truncate);
        when(target.prepareStatement(anyString())).thenAnswer(inv -> {
            preparedSql.add(inv.getArgument(0));
            return setval;
        });
        when(postgresConnectionService.getConnection()).thenReturn(target);
        when(copyWriter.copyIn(any(), anyString(), anyString())).thenReturn(2L, 1L);

        DataTransferResult result = new DataTransferResult();
        service.transferTable(orders(), result, () -> false, rows -> { });

        assertEquals(List.of("public.Orders"), result.getTransferredTables());
        verify(truncate).execute("TRUNCATE TABLE \"public\".\"Orders\"");
        assertEquals(1, preparedSql.size());
        assertTrue(preparedSql.get(0).startsWith("SELECT setval(pg_get_serial_sequence(?, ?), MAX(\"Id\"))"));
        verify(setval).setString(1, "\"public\".\"Orders\"");
        verify(setval).setString(2, "Id");
        verify(setval).execute();
        // truncate, two batches and the sequence reset
        verify(target, times(4)).commit();
    }

    @Test
    void transferTable_truncateRetriedOnFreshConnection() throws Exception {
        Connection broken = mock(Connection.class);
        Statement failing = mock(Statement.class);
        when(broken.createStatement()).thenReturn(failing);
        when(failing.execute(anyString())).thenThrow(new SQLException("connection reset", "08006"));
        Connection fresh = targetConnection();
        when(postgresConnectionService.getConnection()).thenReturn(broken, fresh);
        when(copyWriter.copyIn(eq(fresh), anyString(), anyString())).thenReturn(2L, 1L);

        DataTransferResult result = new DataTransferResult();
        service.transferTable(notes(), result, () -> false, rows -> { });

        assertEquals(1, result.getTransferredCount());
        verify(broken).rollback();
        verify(broken).close();
        verify(copyWriter, never()).copyIn(eq(broken), anyString(), anyString());
    }

    // ========== Source cursor ==========

    @Test
    void transferTable_sourceConnectionErrorIsRetried() throws Exception {
        when(sqlServerConnectionService.getConnection())
                .thenThrow(new SQLException("connection reset by peer", "08S01"))
                .thenReturn(source);
        Connection target = targetConnection();
        when(postgresConnectionService.getConnection()).thenReturn(target);
        when(copyWriter.copyIn(any(), anyString(), anyString())).thenReturn(2L, 1L);

        DataTransferResult result = new DataTransferResult();
        service.transferTable(notes(), result, () -> false, rows -> { });

        assertEquals(1, result.getTransferredCount());
        assertEquals(3, result.getTotalRowsTransferred());
        verify(sqlServerConnectionService, times(2)).getConnection();
    }

    @Test
    void transferTable_nonTransientSourceErrorFailsBeforeTouchingTarget() throws Exception {
        when(source.prepareStatement(anyString(), anyInt(), anyInt()))
                .thenThrow(new SQLException("Invalid object name 'dbo.Notes'", "S0002"));

        DataTransferResult result = new DataTransferResult();
        service.transferTable(notes(), result, () -> false, rows -> { });

        assertEquals(1, result.getErrorCount());
        assertTrue(result.getErrors().get(0).getMessage().contains("Invalid object name"));
        verify(source).close();
        verify(sqlServerConnectionService, times(1)).getConnection();
        verifyNoInteractions(postgresConnectionService);
    }
}
