package me.christianrobert.mspgsync.core.job.model.verification;

import me.christianrobert.mspgsync.core.job.model.MigrationStepResult;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Column mapping report of step 2: how each source table and column corresponds to PostgreSQL.
 *
 * The report never fails a run. A table counts as a failure when a column is missing or of another
 * type category, when the table itself is missing, or when row counts differ.
 */
public class VerificationReport implements MigrationStepResult {

    public enum ColumnStatus {
        MATCHED,
        TYPE_MISMATCH,
        MISSING
    }

    private final List<TableVerification> tables = new ArrayList<>();
    private final LocalDateTime executionDateTime = LocalDateTime.now();
    private String reportPath;

    public synchronized void addTable(TableVerification table) {
        tables.add(table);
    }

    public synchronized List<TableVerification> getTables() {
        return new ArrayList<>(tables);
    }

    public String getReportPath() {
        return reportPath;
    }

    public void setReportPath(String reportPath) {
        this.reportPath = reportPath;
    }

    public LocalDateTime getExecutionDateTime() {
        return executionDateTime;
    }

    public synchronized int getMatchedTableCount() {
        return (int) tables.stream().filter(TableVerification::isMatched).count();
    }

    public synchronized int getMismatchedTableCount() {
        return tables.size() - getMatchedTableCount();
    }

    @Override
    public int getSuccessCount() {
        return getMatchedTableCount();
    }

    @Override
    public int getFailureCount() {
        return getMismatchedTableCount();
    }

    @Override
    public synchronized List<String> getFailureMessages() {
        List<String> messages = new ArrayList<>();
        for (TableVerification table : tables) {
            if (!table.isMatched()) {
                messages.add(table.getTargetTable() + ": " + table.describeProblems());
            }
        }
        return messages;
    }

    public static class TableVerification {
        private final String sourceTable;
        private final String targetTable;
        private final boolean targetExists;
        private final int sourceColumnCount;
        private final int targetColumnCount;
        private final List<ColumnVerification> columns;
        private final Long sourceRowCount;
        private final Long targetRowCount;
        private final String message;

        public TableVerification(String sourceTable, String targetTable, boolean targetExists,
                                 int sourceColumnCount, int targetColumnCount, List<ColumnVerification> columns,
                                 Long sourceRowCount, Long targetRowCount, String message) {
            this.sourceTable = sourceTable;
            this.targetTable = targetTable;
            this.targetExists = targetExists;
            this.sourceColumnCount = sourceColumnCount;
            this.targetColumnCount = targetColumnCount;
            this.columns = List.copyOf(columns);
            this.sourceRowCount = sourceRowCount;
            this.targetRowCount = targetRowCount;
            this.message = message;
        }

        public String getSourceTable() {
            return sourceTable;
        }

        public String getTargetTable() {
            return targetTable;
        }

        public boolean isTargetExists() {
            return targetExists;
        }

        public int getSourceColumnCount() {
            return sourceColumnCount;
        }

        public int getTargetColumnCount() {
            return targetColumnCount;
        }

        public List<ColumnVerification> getColumns() {
            return columns;
        }

        /**
         * Null when row counts were not compared (data transfer disabled or counting failed).
         */
        public Long getSourceRowCount() {
            return sourceRowCount;
        }

        public Long getTargetRowCount() {
            return targetRowCount;
        }

        public String getMessage() {
            return message;
        }

        public boolean isRowCountMatched() {
            return sourceRowCount == null || targetRowCount == null || sourceRowCount.equals(targetRowCount);
        }

        public boolean isMatched() {
            return targetExists
                    && sourceColumnCount == targetColumnCount
                    && isRowCountMatched()
                    && columns.stream().allMatch(c -> c.getStatus() == ColumnStatus.MATCHED);
        }

        String describeProblems() {
            if (!targetExists) {
                return "table missing in PostgreSQL";
            }
            List<String> problems = new ArrayList<>();
            if (sourceColumnCount != targetColumnCount) {
                problems.add(String.format("column count %d vs %d", sourceColumnCount, targetColumnCount));
            }
            for (ColumnVerification column : columns) {
                if (column.getStatus() != ColumnStatus.MATCHED) {
                    problems.add(column.getSourceColumn() + " " + column.getStatus());
                }
            }
            if (!isRowCountMatched()) {
                problems.add(String.format("row count %d vs %d", sourceRowCount, targetRowCount));
            }
            return String.join(", ", problems);
        }
    }

    public static class ColumnVerification {
        private final String sourceColumn;
        private final String sourceType;
        private final String targetColumn;
        private final String targetType;
        private final String expectedCategory;
        private final String actualCategory;
        private final ColumnStatus status;

        public ColumnVerification(String sourceColumn, String sourceType, String targetColumn, String targetType,
                                  String expectedCategory, String actualCategory, ColumnStatus status) {
            this.sourceColumn = sourceColumn;
            this.sourceType = sourceType;
            this.targetColumn = targetColumn;
            this.targetType = targetType;
            this.expectedCategory = expectedCategory;
            this.actualCategory = actualCategory;
            this.status = status;
        }

        public String getSourceColumn() {
            return sourceColumn;
        }

        public String getSourceType() {
            return sourceType;
        }

        public String getTargetColumn() {
            return targetColumn;
        }

        public String getTargetType() {
            return targetType;
        }

        public String getExpectedCategory() {
            return expectedCategory;
        }

        public String getActualCategory() {
            return actualCategory;
        }

        public ColumnStatus getStatus() {
            return status;
        }

        @Override
        public String toString() {
            return String.format("ColumnVerification{%s -> %s, status=%s}", sourceColumn, targetColumn, status);
        }
    }

    @Override
    public String toString() {
        return String.format("VerificationReport{tables=%d, matched=%d, mismatched=%d}",
                tables.size(), getMatchedTableCount(), getMismatchedTableCount());
    }
}
