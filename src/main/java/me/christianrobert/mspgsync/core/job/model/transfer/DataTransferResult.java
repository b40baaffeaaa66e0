package me.christianrobert.mspgsync.core.job.model.transfer;

import me.christianrobert.mspgsync.core.job.model.MigrationStepResult;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of the bulk data transfer. Tables are processed concurrently,
 * so all mutators are synchronized.
 */
public class DataTransferResult implements MigrationStepResult {

    public enum TableStatus {
        TRANSFERRED,
        SKIPPED,
        FAILED,
        CANCELLED
    }

    private final List<TableTransfer> tables = new ArrayList<>();
    private final LocalDateTime executionDateTime = LocalDateTime.now();

    public synchronized void addTransferredTable(String qualifiedTableName, long rowsTransferred) {
        tables.add(new TableTransfer(qualifiedTableName, TableStatus.TRANSFERRED, rowsTransferred, null));
    }

    /**
     * Adds a skipped table (data transfer disabled or nothing to transfer).
     */
    public synchronized void addSkippedTable(String qualifiedTableName, String reason) {
        tables.add(new TableTransfer(qualifiedTableName, TableStatus.SKIPPED, 0, reason));
    }

    /**
     * Adds a failed table. Rows of batches committed before the failure stay in PostgreSQL.
     */
    public synchronized void addError(String qualifiedTableName, long rowsCommitted, String errorMessage) {
        tables.add(new TableTransfer(qualifiedTableName, TableStatus.FAILED, rowsCommitted, errorMessage));
    }

    public synchronized void addCancelledTable(String qualifiedTableName, long rowsCommitted) {
        tables.add(new TableTransfer(qualifiedTableName, TableStatus.CANCELLED, rowsCommitted,
                "Cancelled after " + rowsCommitted + " committed rows"));
    }

    public synchronized List<TableTransfer> getTables() {
        return new ArrayList<>(tables);
    }

    public synchronized List<String> getTransferredTables() {
        return namesWith(TableStatus.TRANSFERRED);
    }

    public synchronized List<String> getSkippedTables() {
        return namesWith(TableStatus.SKIPPED);
    }

    public synchronized List<TableTransfer> getErrors() {
        return tables.stream().filter(t -> t.getStatus() == TableStatus.FAILED).toList();
    }

    private List<String> namesWith(TableStatus status) {
        return tables.stream().filter(t -> t.getStatus() == status).map(TableTransfer::getTableName).toList();
    }

    public synchronized int getTransferredCount() {
        return namesWith(TableStatus.TRANSFERRED).size();
    }

    public synchronized int getSkippedCount() {
        return namesWith(TableStatus.SKIPPED).size();
    }

    public synchronized int getErrorCount() {
        return namesWith(TableStatus.FAILED).size();
    }

    public synchronized int getCancelledCount() {
        return namesWith(TableStatus.CANCELLED).size();
    }

    public synchronized int getTotalProcessed() {
        return tables.size();
    }

    public synchronized long getTotalRowsTransferred() {
        return tables.stream().mapToLong(TableTransfer::getRows).sum();
    }

    public boolean isSuccessful() {
        return getErrorCount() == 0 && getCancelledCount() == 0;
    }

    public boolean hasErrors() {
        return getErrorCount() > 0;
    }

    public LocalDateTime getExecutionDateTime() {
        return executionDateTime;
    }

    @Override
    public int getSuccessCount() {
        return getTransferredCount() + getSkippedCount();
    }

    @Override
    public int getFailureCount() {
        return getErrorCount() + getCancelledCount();
    }

    @Override
    public synchronized List<String> getFailureMessages() {
        List<String> messages = new ArrayList<>();
        for (TableTransfer table : tables) {
            if (table.getStatus() == TableStatus.FAILED || table.getStatus() == TableStatus.CANCELLED) {
                messages.add(table.getTableName() + ": " + table.getMessage());
            }
        }
        return messages;
    }

    public static class TableTransfer {
        private final String tableName;
        private final TableStatus status;
        private final long rows;
        private final String message;

        public TableTransfer(String tableName, TableStatus status, long rows, String message) {
            this.tableName = tableName;
            this.status = status;
            this.rows = rows;
            this.message = message;
        }

        public String getTableName() {
            return tableName;
        }

        public TableStatus getStatus() {
            return status;
        }

        public long getRows() {
            return rows;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return String.format("TableTransfer{table='%s', status=%s, rows=%d}", tableName, status, rows);
        }
    }

    @Override
    public String toString() {
        return String.format("DataTransferResult{transferred=%d, skipped=%d, errors=%d, cancelled=%d, rows=%d}",
                getTransferredCount(), getSkippedCount(), getErrorCount(), getCancelledCount(),
                getTotalRowsTransferred());
    }
}
