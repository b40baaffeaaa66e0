package me.christianrobert.mspgsync.transfer.job;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.job.AbstractDatabaseWriteJob;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.transfer.DataTransferResult;
import me.christianrobert.mspgsync.database.service.PostgresConnectionService;
import me.christianrobert.mspgsync.database.service.SqlServerConnectionService;
import me.christianrobert.mspgsync.transfer.service.TableDataTransferService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Copies the rows of every table created in step 1 from SQL Server to PostgreSQL.
 *
 * Tables are transferred concurrently by a fixed pool bounded by both {@code migration.worker-threads}
 * and the smaller connection pool, since every worker holds one connection on each side. A failing
 * table does not stop the others.
 */
@Dependent
public class DataTransferJob extends AbstractDatabaseWriteJob<DataTransferResult> {

    private static final Logger log = LoggerFactory.getLogger(DataTransferJob.class);

    @Inject
    SqlServerConnectionService sqlServerConnectionService;

    @Inject
    PostgresConnectionService postgresConnectionService;

    @Inject
    TableDataTransferService tableDataTransferService;

    @Override
    public String getTargetDatabase() {
        return "POSTGRES";
    }

    @Override
    public String getWriteOperationType() {
        return "DATA_TRANSFER";
    }

    @Override
    public Class<DataTransferResult> getResultType() {
        return DataTransferResult.class;
    }

    @Override
    protected void saveResultsToState(DataTransferResult result) {
        stateService.setDataTransferResult(result);
    }

    @Override
    protected DataTransferResult performWriteOperation(Consumer<JobProgress> progressCallback) throws Exception {
        updateProgress(progressCallback, 0, "Initializing", "Starting data transfer from SQL Server to PostgreSQL");

        DataTransferResult result = new DataTransferResult();
        List<TableDefinition> tables = stateService.getTableDefinitions();

        if (tables.isEmpty()) {
            updateProgress(progressCallback, 100, "No tables to process",
                    "No table definitions found in state. Run table creation first.");
            log.warn("No table definitions found in state for data transfer");
            return result;
        }

        if (!configService.isEnabled(ConfigService.MIGRATE_DATA)) {
            for (TableDefinition table : tables) {
                result.addSkippedTable(table.getTargetQualifiedName(), "Data migration disabled");
            }
            updateProgress(progressCallback, 100, "Skipped", "Data migration disabled by configuration");
            log.info("Data migration disabled, {} tables skipped", tables.size());
            return result;
        }

        int workers = workerCount(tables.size());
        updateProgress(progressCallback, 5, "Transferring",
                String.format("Transferring %d tables with %d workers", tables.size(), workers));
        log.info("Transferring data of {} tables with {} workers", tables.size(), workers);

        Map<String, Long> counters = new LinkedHashMap<>();
        for (TableDefinition table : tables) {
            counters.put(table.getTargetQualifiedName(), 0L);
        }
        AtomicInteger finished = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            Map<String, Future<?>> futures = new LinkedHashMap<>();
            for (TableDefinition table : tables) {
                String tableName = table.getTargetQualifiedName();
                futures.put(tableName, executor.submit(() -> {
                    if (isCancellationRequested()) {
                        result.addCancelledTable(tableName, 0);
                        return;
                    }
                    tableDataTransferService.transferTable(table, result, this::isCancellationRequested,
                            rows -> publishCounters(progressCallback, counters, tableName, rows, finished.get(), tables.size()));
                    int done = finished.incrementAndGet();
                    publishCounters(progressCallback, counters, tableName, counters.get(tableName), done, tables.size());
                }));
            }
            for (Map.Entry<String, Future<?>> entry : futures.entrySet()) {
                try {
                    entry.getValue().get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Unexpected failure transferring {}", entry.getKey(), cause);
                    result.addError(entry.getKey(), 0, "Unexpected failure: " + cause);
                }
            }
        } finally {
            executor.shutdown();
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }

        log.info("Data transfer finished: {}", result);
        return result;
    }

    int workerCount(int tableCount) {
        int configured = Math.max(1, configService.getConfigValueAsInt(ConfigService.WORKER_THREADS, 4));
        int poolBound = Math.min(sqlServerConnectionService.getMaximumPoolSize(),
                postgresConnectionService.getMaximumPoolSize());
        return Math.max(1, Math.min(Math.min(configured, poolBound), tableCount));
    }

    private void publishCounters(Consumer<JobProgress> progressCallback, Map<String, Long> counters,
                                 String tableName, long rows, int finishedTables, int totalTables) {
        if (progressCallback == null) {
            return;
        }
        Map<String, Long> snapshot;
        synchronized (counters) {
            counters.put(tableName, rows);
            snapshot = new LinkedHashMap<>(counters);
        }
        int percentage = 5 + (finishedTables * 80 / totalTables);
        progressCallback.accept(new JobProgress(percentage, "Transferring: " + tableName,
                String.format("%d of %d tables finished", finishedTables, totalTables), snapshot));
    }

    @Override
    protected String generateSummaryMessage(DataTransferResult result) {
        if (result.getTotalProcessed() == 0) {
            return "No tables processed for data transfer";
        }

        String baseMessage = String.format(
                "Data transfer completed: %d tables transferred, %d skipped, %,d total rows",
                result.getTransferredCount(),
                result.getSkippedCount(),
                result.getTotalRowsTransferred()
        );

        if (result.hasErrors()) {
            baseMessage += String.format(" (%d tables had errors)", result.getErrorCount());
        }
        if (result.getCancelledCount() > 0) {
            baseMessage += String.format(" (%d tables cancelled)", result.getCancelledCount());
        }

        return baseMessage;
    }
}
