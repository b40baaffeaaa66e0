package me.christianrobert.mspgsync.migration.model;

import me.christianrobert.mspgsync.core.job.model.MigrationStepResult;
import me.christianrobert.mspgsync.core.job.model.RunOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one numbered migration step: counts, failure messages and elapsed time.
 */
public class StepResult {

    private final int stepNumber;
    private final String stepName;
    private final RunOutcome outcome;
    private final int successCount;
    private final int failureCount;
    private final List<String> failures;
    private final long elapsedMillis;
    private final boolean skipped;

    private StepResult(int stepNumber, String stepName, RunOutcome outcome, int successCount, int failureCount,
                       List<String> failures, long elapsedMillis, boolean skipped) {
        this.stepNumber = stepNumber;
        this.stepName = stepName;
        this.outcome = outcome;
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.failures = List.copyOf(failures);
        this.elapsedMillis = elapsedMillis;
        this.skipped = skipped;
    }

    /**
     * Aggregates the results of the jobs a step consists of.
     */
    public static StepResult completed(int stepNumber, String stepName, List<? extends MigrationStepResult> results,
                                       long elapsedMillis) {
        int successes = 0;
        int failureCount = 0;
        List<String> failures = new ArrayList<>();
        RunOutcome outcome = RunOutcome.SUCCESS;
        for (MigrationStepResult result : results) {
            successes += result.getSuccessCount();
            failureCount += result.getFailureCount();
            failures.addAll(result.getFailureMessages());
            outcome = outcome.combine(result.getOutcome());
        }
        return new StepResult(stepNumber, stepName, outcome, successes, failureCount, failures, elapsedMillis, false);
    }

    public static StepResult fatal(int stepNumber, String stepName, String message, long elapsedMillis) {
        return new StepResult(stepNumber, stepName, RunOutcome.FATAL_FAILURE, 0, 1, List.of(message),
                elapsedMillis, false);
    }

    public static StepResult skipped(int stepNumber, String stepName, String reason) {
        return new StepResult(stepNumber, stepName, RunOutcome.SUCCESS, 0, 0, List.of(reason), 0, true);
    }

    public int getStepNumber() {
        return stepNumber;
    }

    public String getStepName() {
        return stepName;
    }

    public RunOutcome getOutcome() {
        return outcome;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public List<String> getFailures() {
        return failures;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public boolean isSkipped() {
        return skipped;
    }

    @Override
    public String toString() {
        return String.format("Step %d (%s): %s, %d succeeded, %d failed in %d ms",
                stepNumber, stepName, skipped ? "SKIPPED" : outcome.name(), successCount, failureCount, elapsedMillis);
    }
}
