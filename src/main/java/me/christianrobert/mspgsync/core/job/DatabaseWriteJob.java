package me.christianrobert.mspgsync.core.job;

/**
 * Job that reads from SQL Server and writes to PostgreSQL (or, for script conversion, to files).
 * One implementation exists per migration step.
 *
 * @param <T> The type of result data produced by the step (e.g., TableCreationResult)
 */
public interface DatabaseWriteJob<T> extends Job<T> {

    /**
     * @return The target system the step writes to ("POSTGRES" or "FILESYSTEM")
     */
    String getTargetDatabase();

    /**
     * @return The operation performed, e.g. "TABLE_CREATION", "DATA_TRANSFER"
     */
    String getWriteOperationType();

    Class<T> getResultType();

    default String getJobTypeIdentifier() {
        return getTargetDatabase() + "_" + getWriteOperationType();
    }
}
