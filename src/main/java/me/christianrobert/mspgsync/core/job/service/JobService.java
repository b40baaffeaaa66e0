package me.christianrobert.mspgsync.core.job.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.mspgsync.core.job.Job;
import me.christianrobert.mspgsync.core.job.exception.JobCancelledException;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.job.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs submitted jobs on a shared pool and keeps their execution records.
 */
@ApplicationScoped
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final Map<String, JobExecution<?>> jobExecutions = new ConcurrentHashMap<>();

    private ExecutorService executorService;

    @PostConstruct
    public void init() {
        log.info("Initializing shared ExecutorService for job execution");
        executorService = Executors.newCachedThreadPool();
    }

    /**
     * Waits up to 30 seconds for running jobs on shutdown.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ExecutorService");
        shutdownExecutorService(executorService, 30);
    }

    private void shutdownExecutorService(ExecutorService executor, int timeoutSeconds) {
        if (executor == null || executor.isShutdown()) {
            return;
        }

        try {
            executor.shutdown();
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Executor did not terminate in {}s, forcing shutdown", timeoutSeconds);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while shutting down executor service", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static class JobExecution<T> {
        private final Job<T> job;
        private volatile JobStatus status;
        private volatile JobProgress progress;
        private volatile LocalDateTime startTime;
        private volatile LocalDateTime endTime;
        private volatile T result;
        private volatile Throwable error;
        private volatile CompletableFuture<T> future;

        public JobExecution(Job<T> job) {
            this.job = job;
            this.status = JobStatus.PENDING;
            this.progress = new JobProgress();
        }

        public Job<T> getJob() { return job; }
        public JobStatus getStatus() { return status; }
        public void setStatus(JobStatus status) { this.status = status; }
        public JobProgress getProgress() { return progress; }
        public void setProgress(JobProgress progress) { this.progress = progress; }
        public LocalDateTime getStartTime() { return startTime; }
        public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }
        public LocalDateTime getEndTime() { return endTime; }
        public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }
        public T getResult() { return result; }
        public void setResult(T result) { this.result = result; }
        public Throwable getError() { return error; }
        public void setError(Throwable error) { this.error = error; }
        public CompletableFuture<T> getFuture() { return future; }
        public void setFuture(CompletableFuture<T> future) { this.future = future; }
    }

    public <T> String submitJob(Job<T> job) {
        String jobId = job.getJobId();

        log.info("Submitting job: {} ({})", jobId, job.getJobType());

        JobExecution<T> execution = new JobExecution<>(job);
        jobExecutions.put(jobId, execution);

        CompletableFuture<T> future = CompletableFuture.supplyAsync(
                () -> runToCompletion(job, execution), executorService);

        execution.setFuture(future);
        return jobId;
    }

    private <T> T runToCompletion(Job<T> job, JobExecution<T> execution) {
        String jobId = job.getJobId();
        execution.setStatus(JobStatus.RUNNING);
        execution.setStartTime(LocalDateTime.now());

        log.info("Starting job execution: {}", jobId);

        try {
            T result = job.execute(progress -> {
                execution.setProgress(progress);
                log.debug("Job {} progress: {}%", jobId, progress.getPercentage());
            }).get();

            execution.setResult(result);
            execution.setStatus(JobStatus.COMPLETED);
            log.info("Job completed successfully: {}", jobId);
            return result;

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            execution.setError(cause);
            if (cause instanceof JobCancelledException) {
                execution.setStatus(JobStatus.CANCELLED);
                log.info("Job cancelled: {}", jobId);
            } else {
                execution.setStatus(JobStatus.FAILED);
                log.error("Job failed: {}", jobId, cause);
            }
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.setError(e);
            execution.setStatus(JobStatus.CANCELLED);
            log.warn("Job interrupted: {}", jobId);
            return null;
        } finally {
            execution.setEndTime(LocalDateTime.now());
        }
    }

    /**
     * Requests cooperative cancellation of a running job.
     *
     * @return false if the job is unknown or already finished
     */
    public boolean cancelJob(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution == null || isJobComplete(jobId)) {
            return false;
        }
        execution.getJob().cancel();
        return true;
    }

    public JobExecution<?> getJobExecution(String jobId) {
        return jobExecutions.get(jobId);
    }

    public JobStatus getJobStatus(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getStatus() : null;
    }

    public JobProgress getJobProgress(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getProgress() : null;
    }

    public <T> T getJobResult(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution != null && execution.getStatus() == JobStatus.COMPLETED) {
            @SuppressWarnings("unchecked")
            T result = (T) execution.getResult();
            return result;
        }
        return null;
    }

    public Throwable getJobError(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getError() : null;
    }

    public boolean isJobComplete(String jobId) {
        JobStatus status = getJobStatus(jobId);
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED || status == JobStatus.CANCELLED;
    }

    public void cleanupOldJobs(int maxAgeHours) {
        LocalDateTime cutoff = LocalDateTime.now().minusHours(maxAgeHours);
        jobExecutions.entrySet().removeIf(entry -> {
            LocalDateTime endTime = entry.getValue().getEndTime();
            return endTime != null && endTime.isBefore(cutoff);
        });
    }

    public Map<String, JobExecution<?>> getAllJobExecutions() {
        return Map.copyOf(jobExecutions);
    }
}
