package me.christianrobert.mspgsync.migration.job;

import me.christianrobert.mspgsync.core.job.Job;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.migration.model.MigrationRunResult;
import me.christianrobert.mspgsync.migration.service.MigrationRunService;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs run-all or a single step in the background so REST callers can poll it through
 * the job endpoints. Not registered in the JobRegistry: it wraps the registered step jobs.
 */
public class MigrationRunJob implements Job<MigrationRunResult> {

    private final MigrationRunService migrationRunService;
    private final Integer stepNumber;
    private final String jobId;
    private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);

    /**
     * @param stepNumber the single step to run, or null for all steps
     */
    public MigrationRunJob(MigrationRunService migrationRunService, Integer stepNumber) {
        this.migrationRunService = migrationRunService;
        this.stepNumber = stepNumber;
        this.jobId = (stepNumber == null ? "migration-run-all-" : "migration-step-" + stepNumber + "-") + UUID.randomUUID();
    }

    @Override
    public String getJobId() {
        return jobId;
    }

    @Override
    public String getJobType() {
        return stepNumber == null ? "MIGRATION_RUN_ALL" : "MIGRATION_STEP_" + stepNumber;
    }

    @Override
    public String getDescription() {
        return stepNumber == null ? "Run all migration steps"
                : "Run migration step " + stepNumber + " (" + MigrationRunService.stepName(stepNumber) + ")";
    }

    @Override
    public CompletableFuture<MigrationRunResult> execute(Consumer<JobProgress> progressCallback) {
        return CompletableFuture.supplyAsync(() -> stepNumber == null
                ? migrationRunService.runAll(progressCallback)
                : migrationRunService.runStep(stepNumber, progressCallback));
    }

    @Override
    public void cancel() {
        if (cancellationRequested.compareAndSet(false, true)) {
            migrationRunService.cancel();
        }
    }

    @Override
    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }
}
