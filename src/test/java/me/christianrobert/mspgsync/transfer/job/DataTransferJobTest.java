package me.christianrobert.mspgsync.transfer.job;

import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.job.model.RunOutcome;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.ColumnMetadata;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.core.job.model.transfer.DataTransferResult;
import me.christianrobert.mspgsync.core.service.StateService;
import me.christianrobert.mspgsync.database.service.PostgresConnectionService;
import me.christianrobert.mspgsync.database.service.SqlServerConnectionService;
import me.christianrobert.mspgsync.transfer.service.TableDataTransferService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for DataTransferJob.
 *
 * Purpose: every table of step 1 ends up in the transfer result, including tables whose
 * worker fails unexpectedly, and disabled data migration skips all tables.
 */
class DataTransferJobTest {

    private TableDataTransferService tableDataTransferService;
    private StateService stateService;
    private ConfigService configService;
    private DataTransferJob dataTransferJob;

    private Consumer<JobProgress> progressCallback;
    private List<JobProgress> progressUpdates;

    @BeforeEach
    void setUp() throws Exception {
        tableDataTransferService = mock(TableDataTransferService.class);
        stateService = mock(StateService.class);
        configService = new ConfigService(Map.of());
        configService.setConfigValue(ConfigService.MIGRATE_DATA, true);

        dataTransferJob = new DataTransferJob();
        injectDependency(dataTransferJob, "tableDataTransferService", tableDataTransferService);
        injectDependency(dataTransferJob, "sqlServerConnectionService", mock(SqlServerConnectionService.class));
        injectDependency(dataTransferJob, "postgresConnectionService", mock(PostgresConnectionService.class));
        injectDependency(dataTransferJob, "stateService", stateService);
        injectDependency(dataTransferJob, "configService", configService);

        progressUpdates = new ArrayList<>();
        progressCallback = progress -> progressUpdates.add(progress);
    }

    private void injectDependency(Object target, String fieldName, Object dependency) throws Exception {
        Field field = null;
        Class<?> clazz = target.getClass();

        while (clazz != null && field == null) {
            try {
                field = clazz.getDeclaredField(fieldName);
            } catch (NoSuchFieldException e) {
                clazz = clazz.getSuperclass();
            }
        }

        if (field != null) {
            field.setAccessible(true);
            field.set(target, dependency);
        } else {
            throw new NoSuchFieldException("Field " + fieldName + " not found in class hierarchy");
        }
    }

    private static TableDefinition table(String name) {
        TableMetadata source = new TableMetadata("dbo", name);
        ColumnMetadata id = new ColumnMetadata("Id", "int", null, 10, 0, false, null, 1);
        source.addColumn(id);
        return new TableDefinition(source, "public", name, List.of(new ColumnMapping(id, "Id", "INTEGER")),
                "", List.of());
    }

    // ========== Worker failures ==========

    @Test
    void execute_unexpectedWorkerFailureIsRecordedAsTableError() throws Exception {
        when(stateService.getTableDefinitions()).thenReturn(List.of(table("Orders"), table("Customers")));
        doThrow(new IllegalStateException("converter blew up"))
                .when(tableDataTransferService).transferTable(argThat(t -> t.getTargetTableName().equals("Orders")),
                        any(), any(), any());
        doAnswer(inv -> {
            DataTransferResult result = inv.getArgument(1);
            result.addTransferredTable("public.Customers", 5);
            return null;
        }).when(tableDataTransferService).transferTable(argThat(t -> t.getTargetTableName().equals("Customers")),
                any(), any(), any());

        DataTransferResult result = dataTransferJob.execute(progressCallback).get();

        assertEquals(2, result.getTotalProcessed());
        assertEquals(1, result.getErrorCount());
        assertEquals("public.Orders", result.getErrors().get(0).getTableName());
        assertTrue(result.getErrors().get(0).getMessage().contains("converter blew up"));
        assertEquals(List.of("public.Customers"), result.getTransferredTables());
        assertFalse(result.isSuccessful());
        assertEquals(RunOutcome.PARTIAL_SUCCESS, result.getOutcome());
        verify(stateService).setDataTransferResult(result);
    }

    @Test
    void execute_onlyTableFailingLeavesNoSilentSuccess() throws Exception {
        when(stateService.getTableDefinitions()).thenReturn(List.of(table("Orders")));
        doThrow(new IllegalStateException("boom")).when(tableDataTransferService)
                .transferTable(any(), any(), any(), any());

        DataTransferResult result = dataTransferJob.execute(progressCallback).get();

        assertEquals(1, result.getTables().size());
        assertEquals(DataTransferResult.TableStatus.FAILED, result.getTables().get(0).getStatus());
        assertFalse(result.isSuccessful());
    }

    // ========== Configuration ==========

    @Test
    void execute_disabledDataMigrationSkipsEveryTable() throws Exception {
        configService.setConfigValue(ConfigService.MIGRATE_DATA, false);
        when(stateService.getTableDefinitions()).thenReturn(List.of(table("Orders"), table("Customers")));

        DataTransferResult result = dataTransferJob.execute(progressCallback).get();

        assertEquals(2, result.getSkippedCount());
        verifyNoInteractions(tableDataTransferService);
        assertEquals(100, progressUpdates.get(progressUpdates.size() - 1).getPercentage());
    }

    @Test
    void execute_withoutTablesReportsNothingToDo() throws Exception {
        when(stateService.getTableDefinitions()).thenReturn(List.of());

        DataTransferResult result = dataTransferJob.execute(progressCallback).get();

        assertEquals(0, result.getTotalProcessed());
        verifyNoInteractions(tableDataTransferService);
    }
}
