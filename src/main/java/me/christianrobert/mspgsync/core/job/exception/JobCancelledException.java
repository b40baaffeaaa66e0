package me.christianrobert.mspgsync.core.job.exception;

/**
 * Thrown when a job notices its cancellation flag between units of work.
 *
 * This is not an error: the JobService marks the job as CANCELLED rather than FAILED,
 * and everything committed before the check stays committed.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String message) {
        super(message);
    }
}
