package me.christianrobert.mspgsync.migration.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.core.exception.CyclicConstraintException;
import me.christianrobert.mspgsync.core.job.Job;
import me.christianrobert.mspgsync.core.job.exception.JobCancelledException;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.job.model.MigrationStepResult;
import me.christianrobert.mspgsync.core.job.model.RunOutcome;
import me.christianrobert.mspgsync.core.job.model.collation.CollationMigrationResult;
import me.christianrobert.mspgsync.core.job.service.JobRegistry;
import me.christianrobert.mspgsync.core.service.StateService;
import me.christianrobert.mspgsync.migration.model.MigrationRunResult;
import me.christianrobert.mspgsync.migration.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Runs the numbered migration steps in order:
 * 1. Schema and data (table creation, then data transfer)
 * 2. Column verification
 * 3. Constraints and indexes
 * 4. Collations
 *
 * Each step's jobs run one after the other because every step reads what the previous one
 * committed. A fatal failure aborts the run, except a foreign key cycle which is fatal to
 * step 3 only.
 */
@ApplicationScoped
public class MigrationRunService {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunService.class);

    public static final int FIRST_STEP = 1;
    public static final int LAST_STEP = 4;

    @Inject
    JobRegistry jobRegistry;

    @Inject
    StateService stateService;

    private volatile Job<?> currentJob;
    private volatile boolean cancellationRequested;

    public MigrationRunResult runAll(Consumer<JobProgress> progressCallback) {
        log.info("Starting full migration run (steps {}-{})", FIRST_STEP, LAST_STEP);
        cancellationRequested = false;
        stateService.resetRunState();

        long start = System.currentTimeMillis();
        MigrationRunResult run = new MigrationRunResult();
        for (int step = FIRST_STEP; step <= LAST_STEP; step++) {
            if (cancellationRequested) {
                log.info("Migration run cancelled before step {}", step);
                run.markAborted();
                break;
            }
            StepResult stepResult = executeStep(step, progressCallback);
            run.addStep(stepResult);
            if (abortsRun(stepResult)) {
                log.error("Step {} failed fatally, aborting the migration run", step);
                run.markAborted();
                break;
            }
        }
        run.setElapsedMillis(System.currentTimeMillis() - start);
        log.info("Migration run finished: {}", run);
        return run;
    }

    /**
     * Runs a single step on the state left by earlier runs.
     *
     * @throws IllegalArgumentException if the step number is not between 1 and 4
     */
    public MigrationRunResult runStep(int stepNumber, Consumer<JobProgress> progressCallback) {
        stepName(stepNumber);
        cancellationRequested = false;

        long start = System.currentTimeMillis();
        MigrationRunResult run = new MigrationRunResult();
        StepResult stepResult = executeStep(stepNumber, progressCallback);
        run.addStep(stepResult);
        if (abortsRun(stepResult)) {
            run.markAborted();
        }
        run.setElapsedMillis(System.currentTimeMillis() - start);
        log.info("Step {} finished: {}", stepNumber, run);
        return run;
    }

    /**
     * Cancels the job currently running; committed work is kept and no further step starts.
     */
    public void cancel() {
        cancellationRequested = true;
        Job<?> job = currentJob;
        if (job != null) {
            job.cancel();
        }
    }

    StepResult executeStep(int stepNumber, Consumer<JobProgress> progressCallback) {
        String name = stepName(stepNumber);
        log.info("Starting step {}: {}", stepNumber, name);
        long start = System.currentTimeMillis();

        List<MigrationStepResult> results = new ArrayList<>();
        try {
            for (String operation : operations(stepNumber)) {
                if (cancellationRequested) {
                    return StepResult.fatal(stepNumber, name, "Cancelled before " + operation,
                            System.currentTimeMillis() - start);
                }
                results.add(runJob(operation, progressCallback));
            }
        } catch (CyclicConstraintException e) {
            log.error("Step {} failed: {}", stepNumber, e.getMessage());
            return StepResult.fatal(stepNumber, name, e.getMessage(), System.currentTimeMillis() - start);
        } catch (JobCancelledException e) {
            log.info("Step {} cancelled: {}", stepNumber, e.getMessage());
            return StepResult.fatal(stepNumber, name, "Cancelled: " + e.getMessage(), System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            log.error("Step {} failed fatally", stepNumber, e);
            return StepResult.fatal(stepNumber, name, e.getMessage(), System.currentTimeMillis() - start);
        }

        long elapsed = System.currentTimeMillis() - start;
        if (results.size() == 1 && results.get(0) instanceof CollationMigrationResult
                && ((CollationMigrationResult) results.get(0)).isSkipped()) {
            return StepResult.skipped(stepNumber, name, "Collation migration disabled by configuration");
        }
        StepResult stepResult = StepResult.completed(stepNumber, name, results, elapsed);
        log.info("{}", stepResult);
        return stepResult;
    }

    private MigrationStepResult runJob(String operation, Consumer<JobProgress> progressCallback) {
        Job<?> job = jobRegistry.createJob("POSTGRES", operation)
                .orElseThrow(() -> new IllegalStateException("No job registered for POSTGRES " + operation));
        currentJob = job;
        try {
            Object result = job.execute(progressCallback).get();
            if (!(result instanceof MigrationStepResult)) {
                throw new IllegalStateException(operation + " produced no step result");
            }
            return (MigrationStepResult) result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.cancel();
            throw new JobCancelledException(operation + " interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(operation + " failed: " + cause.getMessage(), cause);
        } finally {
            currentJob = null;
        }
    }

    private boolean abortsRun(StepResult stepResult) {
        return stepResult.getOutcome() == RunOutcome.FATAL_FAILURE && stepResult.getStepNumber() != 3;
    }

    static List<String> operations(int stepNumber) {
        switch (stepNumber) {
            case 1:
                return List.of("TABLE_CREATION", "DATA_TRANSFER");
            case 2:
                return List.of("COLUMN_VERIFICATION");
            case 3:
                return List.of("CONSTRAINT_CREATION");
            case 4:
                return List.of("COLLATION_MIGRATION");
            default:
                throw new IllegalArgumentException("Unknown step: " + stepNumber);
        }
    }

    public static String stepName(int stepNumber) {
        switch (stepNumber) {
            case 1:
                return "Schema and data";
            case 2:
                return "Verification";
            case 3:
                return "Constraints and indexes";
            case 4:
                return "Collations";
            default:
                throw new IllegalArgumentException(String.format("Step must be between %d and %d, got %d",
                        FIRST_STEP, LAST_STEP, stepNumber));
        }
    }
}
