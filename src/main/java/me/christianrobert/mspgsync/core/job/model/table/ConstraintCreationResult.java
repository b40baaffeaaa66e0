package me.christianrobert.mspgsync.core.job.model.table;

import me.christianrobert.mspgsync.core.job.model.MigrationStepResult;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of constraint and index creation in PostgreSQL.
 *
 * Every statement is recorded independently: one failing constraint does not
 * prevent the others, and the result keeps the emission order.
 */
public class ConstraintCreationResult implements MigrationStepResult {

    private final List<ConstraintInfo> createdConstraints = new ArrayList<>();
    private final List<ConstraintInfo> skippedConstraints = new ArrayList<>();
    private final List<ConstraintCreationError> errors = new ArrayList<>();
    private final List<String> emittedStatements = new ArrayList<>();
    private final LocalDateTime executionDateTime = LocalDateTime.now();

    /**
     * @param qualifiedTableName Target table (schema.table)
     * @param constraintName The name used in PostgreSQL (possibly shortened)
     * @param constraintType P, U, R, C, or I for indexes
     */
    public void addCreatedConstraint(String qualifiedTableName, String constraintName, String constraintType) {
        createdConstraints.add(new ConstraintInfo(qualifiedTableName, constraintName, constraintType, null));
    }

    public void addSkippedConstraint(String qualifiedTableName, String constraintName, String constraintType,
                                     String reason) {
        skippedConstraints.add(new ConstraintInfo(qualifiedTableName, constraintName, constraintType, reason));
    }

    public void addError(String qualifiedTableName, String constraintName, String constraintType,
                         String errorMessage, String sqlStatement) {
        errors.add(new ConstraintCreationError(qualifiedTableName, constraintName, constraintType,
                errorMessage, sqlStatement));
    }

    public void addEmittedStatement(String sql) {
        emittedStatements.add(sql);
    }

    public List<ConstraintInfo> getCreatedConstraints() {
        return new ArrayList<>(createdConstraints);
    }

    public List<ConstraintInfo> getSkippedConstraints() {
        return new ArrayList<>(skippedConstraints);
    }

    public List<ConstraintCreationError> getErrors() {
        return new ArrayList<>(errors);
    }

    /**
     * Statements in the order they were issued.
     */
    public List<String> getEmittedStatements() {
        return new ArrayList<>(emittedStatements);
    }

    public int getCreatedCount() {
        return createdConstraints.size();
    }

    public int getSkippedCount() {
        return skippedConstraints.size();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
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
    public List<String> getFailureMessages() {
        List<String> messages = new ArrayList<>();
        for (ConstraintCreationError error : errors) {
            messages.add(error.getErrorMessage());
        }
        return messages;
    }

    public static class ConstraintInfo {
        private final String tableName;
        private final String constraintName;
        private final String constraintType;
        private final String reason;

        public ConstraintInfo(String tableName, String constraintName, String constraintType, String reason) {
            this.tableName = tableName;
            this.constraintName = constraintName;
            this.constraintType = constraintType;
            this.reason = reason;
        }

        public String getTableName() {
            return tableName;
        }

        public String getConstraintName() {
            return constraintName;
        }

        public String getConstraintType() {
            return constraintType;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public String toString() {
            return String.format("ConstraintInfo{table='%s', name='%s', type='%s'}",
                    tableName, constraintName, constraintType);
        }
    }

    public static class ConstraintCreationError {
        private final String tableName;
        private final String constraintName;
        private final String constraintType;
        private final String errorMessage;
        private final String sqlStatement;

        public ConstraintCreationError(String tableName, String constraintName, String constraintType,
                                       String errorMessage, String sqlStatement) {
            this.tableName = tableName;
            this.constraintName = constraintName;
            this.constraintType = constraintType;
            this.errorMessage = errorMessage;
            this.sqlStatement = sqlStatement;
        }

        public String getTableName() {
            return tableName;
        }

        public String getConstraintName() {
            return constraintName;
        }

        public String getConstraintType() {
            return constraintType;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public String getSqlStatement() {
            return sqlStatement;
        }

        @Override
        public String toString() {
            return String.format("ConstraintCreationError{table='%s', constraint='%s', error='%s'}",
                    tableName, constraintName, errorMessage);
        }
    }

    @Override
    public String toString() {
        return String.format("ConstraintCreationResult{created=%d, skipped=%d, errors=%d}",
                getCreatedCount(), getSkippedCount(), getErrorCount());
    }
}
