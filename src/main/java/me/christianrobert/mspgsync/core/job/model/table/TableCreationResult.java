package me.christianrobert.mspgsync.core.job.model.table;

import me.christianrobert.mspgsync.core.job.model.MigrationStepResult;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of PostgreSQL table creation.
 * Tracks created and skipped tables, failures, and column level warnings
 * (unmapped types, defaults passed through verbatim).
 */
public class TableCreationResult implements MigrationStepResult {

    private final List<String> createdTables = new ArrayList<>();
    private final List<String> skippedTables = new ArrayList<>();
    private final List<TableCreationError> errors = new ArrayList<>();
    private final List<ColumnWarning> columnWarnings = new ArrayList<>();
    private final List<TableDefinition> tableDefinitions = new ArrayList<>();
    private final LocalDateTime executionDateTime = LocalDateTime.now();

    public synchronized void addCreatedTable(String qualifiedTableName) {
        createdTables.add(qualifiedTableName);
    }

    /**
     * Adds a table left untouched because it already exists in PostgreSQL.
     */
    public synchronized void addSkippedTable(String qualifiedTableName) {
        skippedTables.add(qualifiedTableName);
    }

    /**
     * Adds a table that could not be created.
     * @param qualifiedTableName The target table name
     * @param errorMessage The error message
     * @param sqlStatement The SQL statement that failed, may be null
     */
    public synchronized void addError(String qualifiedTableName, String errorMessage, String sqlStatement) {
        errors.add(new TableCreationError(qualifiedTableName, errorMessage, sqlStatement));
    }

    /**
     * Adds a non-fatal column warning.
     * @param qualifiedTableName The source table name
     * @param columnName The source column name
     * @param message What was skipped or passed through, including the source type or expression
     */
    public synchronized void addColumnWarning(String qualifiedTableName, String columnName, String message) {
        columnWarnings.add(new ColumnWarning(qualifiedTableName, columnName, message));
    }

    public synchronized void addTableDefinition(TableDefinition definition) {
        tableDefinitions.add(definition);
    }

    public synchronized List<String> getCreatedTables() {
        return new ArrayList<>(createdTables);
    }

    public synchronized List<String> getSkippedTables() {
        return new ArrayList<>(skippedTables);
    }

    public synchronized List<TableCreationError> getErrors() {
        return new ArrayList<>(errors);
    }

    public synchronized List<ColumnWarning> getColumnWarnings() {
        return new ArrayList<>(columnWarnings);
    }

    /**
     * Definitions of all tables present in PostgreSQL after this step (created or skipped).
     */
    public synchronized List<TableDefinition> getTableDefinitions() {
        return new ArrayList<>(tableDefinitions);
    }

    public synchronized int getCreatedCount() {
        return createdTables.size();
    }

    public synchronized int getSkippedCount() {
        return skippedTables.size();
    }

    public synchronized int getErrorCount() {
        return errors.size();
    }

    public synchronized int getColumnWarningCount() {
        return columnWarnings.size();
    }

    public boolean isSuccessful() {
        return getErrorCount() == 0;
    }

    public boolean hasErrors() {
        return !isSuccessful();
    }

    public LocalDateTime getExecutionDateTime() {
        return executionDateTime;
    }

    @Override
    public int getSuccessCount() {
        return getCreatedCount() + getSkippedCount();
    }

    @Override
    public int getFailureCount() {
        return getErrorCount();
    }

    @Override
    public synchronized List<String> getFailureMessages() {
        List<String> messages = new ArrayList<>();
        for (TableCreationError error : errors) {
            messages.add(error.getErrorMessage());
        }
        return messages;
    }

    public static class TableCreationError {
        private final String tableName;
        private final String errorMessage;
        private final String sqlStatement;

        public TableCreationError(String tableName, String errorMessage, String sqlStatement) {
            this.tableName = tableName;
            this.errorMessage = errorMessage;
            this.sqlStatement = sqlStatement;
        }

        public String getTableName() {
            return tableName;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public String getSqlStatement() {
            return sqlStatement;
        }

        @Override
        public String toString() {
            return String.format("TableCreationError{table='%s', error='%s'}", tableName, errorMessage);
        }
    }

    public static class ColumnWarning {
        private final String tableName;
        private final String columnName;
        private final String message;

        public ColumnWarning(String tableName, String columnName, String message) {
            this.tableName = tableName;
            this.columnName = columnName;
            this.message = message;
        }

        public String getTableName() {
            return tableName;
        }

        public String getColumnName() {
            return columnName;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return tableName + "." + columnName + ": " + message;
        }
    }

    @Override
    public String toString() {
        return String.format("TableCreationResult{created=%d, skipped=%d, errors=%d, warnings=%d}",
                getCreatedCount(), getSkippedCount(), getErrorCount(), getColumnWarningCount());
    }
}
