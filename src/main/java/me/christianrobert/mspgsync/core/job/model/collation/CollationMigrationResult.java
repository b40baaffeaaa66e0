package me.christianrobert.mspgsync.core.job.model.collation;

import me.christianrobert.mspgsync.core.job.model.MigrationStepResult;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of applying collations to PostgreSQL text columns.
 * Columns resolving to the fallback marker keep the database default and count as kept;
 * unresolved collations are recorded but do not fail the step.
 */
public class CollationMigrationResult implements MigrationStepResult {

    private final List<ColumnCollation> applied = new ArrayList<>();
    private final List<ColumnCollation> keptDefault = new ArrayList<>();
    private final List<ColumnCollation> unresolved = new ArrayList<>();
    private final List<ColumnCollation> errors = new ArrayList<>();
    private final LocalDateTime executionDateTime = LocalDateTime.now();
    private boolean skipped;

    public void addApplied(String column, String sourceCollation, String targetCollation) {
        applied.add(new ColumnCollation(column, sourceCollation, targetCollation, null));
    }

    public void addKeptDefault(String column, String sourceCollation) {
        keptDefault.add(new ColumnCollation(column, sourceCollation, null, "Database default collation kept"));
    }

    public void addUnresolved(String column, String sourceCollation, String message) {
        unresolved.add(new ColumnCollation(column, sourceCollation, null, message));
    }

    public void addError(String column, String sourceCollation, String targetCollation, String message) {
        errors.add(new ColumnCollation(column, sourceCollation, targetCollation, message));
    }

    public void markSkipped() {
        this.skipped = true;
    }

    /**
     * Whether the step was disabled by configuration.
     */
    public boolean isSkipped() {
        return skipped;
    }

    public List<ColumnCollation> getApplied() {
        return new ArrayList<>(applied);
    }

    public List<ColumnCollation> getKeptDefault() {
        return new ArrayList<>(keptDefault);
    }

    public List<ColumnCollation> getUnresolved() {
        return new ArrayList<>(unresolved);
    }

    public List<ColumnCollation> getErrors() {
        return new ArrayList<>(errors);
    }

    public int getAppliedCount() {
        return applied.size();
    }

    public int getKeptDefaultCount() {
        return keptDefault.size();
    }

    public int getUnresolvedCount() {
        return unresolved.size();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !isSuccessful();
    }

    public LocalDateTime getExecutionDateTime() {
        return executionDateTime;
    }

    @Override
    public int getSuccessCount() {
        return getAppliedCount() + getKeptDefaultCount();
    }

    @Override
    public int getFailureCount() {
        return getErrorCount() + getUnresolvedCount();
    }

    @Override
    public List<String> getFailureMessages() {
        List<String> messages = new ArrayList<>();
        for (ColumnCollation entry : unresolved) {
            messages.add(entry.getColumn() + ": " + entry.getMessage());
        }
        for (ColumnCollation entry : errors) {
            messages.add(entry.getColumn() + ": " + entry.getMessage());
        }
        return messages;
    }

    public static class ColumnCollation {
        private final String column;
        private final String sourceCollation;
        private final String targetCollation;
        private final String message;

        public ColumnCollation(String column, String sourceCollation, String targetCollation, String message) {
            this.column = column;
            this.sourceCollation = sourceCollation;
            this.targetCollation = targetCollation;
            this.message = message;
        }

        public String getColumn() {
            return column;
        }

        public String getSourceCollation() {
            return sourceCollation;
        }

        public String getTargetCollation() {
            return targetCollation;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return column + " " + sourceCollation + " -> " + (targetCollation != null ? targetCollation : "-")
                    + (message != null ? " (" + message + ")" : "");
        }
    }

    @Override
    public String toString() {
        return String.format("CollationMigrationResult{applied=%d, keptDefault=%d, unresolved=%d, errors=%d}",
                getAppliedCount(), getKeptDefaultCount(), getUnresolvedCount(), getErrorCount());
    }
}
