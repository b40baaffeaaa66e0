package me.christianrobert.mspgsync.core.job;

import me.christianrobert.mspgsync.core.job.model.JobProgress;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

public interface Job<T> {

    String getJobId();

    String getJobType();

    String getDescription();

    CompletableFuture<T> execute(Consumer<JobProgress> progressCallback);

    /**
     * Requests cooperative cancellation. Jobs check the flag between units of work
     * (batches, tables, files); work already committed is kept.
     */
    void cancel();

    boolean isCancellationRequested();

    default void updateProgress(Consumer<JobProgress> progressCallback, int percentage, String currentTask, String details) {
        if (progressCallback != null) {
            progressCallback.accept(new JobProgress(percentage, currentTask, details));
        }
    }
}
