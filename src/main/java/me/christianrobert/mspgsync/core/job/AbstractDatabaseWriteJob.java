package me.christianrobert.mspgsync.core.job;

import jakarta.inject.Inject;
import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.job.exception.JobCancelledException;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.service.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Abstract base class for migration steps providing progress tracking, cooperative
 * cancellation and storing of results in the shared state.
 *
 * @param <T> The type of result being produced by the step
 */
public abstract class AbstractDatabaseWriteJob<T> implements DatabaseWriteJob<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractDatabaseWriteJob.class);

    protected final String jobId;

    private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);

    @Inject
    protected ConfigService configService;

    @Inject
    protected StateService stateService;

    protected AbstractDatabaseWriteJob() {
        this.jobId = getTargetDatabase().toLowerCase() + "-" +
                getWriteOperationType().toLowerCase().replace("_", "-") + "-" +
                UUID.randomUUID();
    }

    @Override
    public String getJobId() {
        return jobId;
    }

    @Override
    public String getJobType() {
        return getJobTypeIdentifier();
    }

    @Override
    public String getDescription() {
        return String.format("Perform %s operation on %s",
                getWriteOperationType().replace("_", " ").toLowerCase(),
                getTargetDatabase());
    }

    @Override
    public void cancel() {
        if (cancellationRequested.compareAndSet(false, true)) {
            log.info("Cancellation requested for job {}", jobId);
        }
    }

    @Override
    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    /**
     * Throws {@link JobCancelledException} when cancellation was requested.
     * Called between units of work only.
     */
    protected void checkCancellation() {
        if (cancellationRequested.get()) {
            throw new JobCancelledException(getWriteOperationType() + " cancelled");
        }
    }

    @Override
    public CompletableFuture<T> execute(Consumer<JobProgress> progressCallback) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return performWriteOperationWithStateUpdating(progressCallback);
            } catch (RuntimeException e) {
                log.error("{} operation failed", getWriteOperationType(), e);
                throw e;
            } catch (Exception e) {
                log.error("{} operation failed", getWriteOperationType(), e);
                throw new CompletionException(String.format("%s operation failed: %s",
                        getWriteOperationType(), e.getMessage()), e);
            }
        });
    }

    /**
     * Template method for performing the actual step.
     */
    protected abstract T performWriteOperation(Consumer<JobProgress> progressCallback) throws Exception;

    /**
     * Saves the step result to the shared state so later steps and REST callers can read it.
     */
    protected abstract void saveResultsToState(T result);

    protected final T performWriteOperationWithStateUpdating(Consumer<JobProgress> progressCallback) throws Exception {
        T result = performWriteOperation(progressCallback);

        updateProgress(progressCallback, 90, "Storing results", "Saving step results to state");
        saveResultsToState(result);

        String summaryMessage = generateSummaryMessage(result);
        updateProgress(progressCallback, 100, "Completed", summaryMessage);

        log.info("{} operation completed: {}", getWriteOperationType(), summaryMessage);
        return result;
    }

    protected String generateSummaryMessage(T result) {
        return String.format("Operation completed: %s",
                getWriteOperationType().replace("_", " ").toLowerCase());
    }
}
