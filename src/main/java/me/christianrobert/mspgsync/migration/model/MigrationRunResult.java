package me.christianrobert.mspgsync.migration.model;

import me.christianrobert.mspgsync.core.job.model.RunOutcome;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of run-all or a single step. The outcome is the most severe outcome of its steps;
 * a run stopped by a fatal step is aborted and lists only the steps that ran.
 */
public class MigrationRunResult {

    private final LocalDateTime startTime = LocalDateTime.now();
    private final List<StepResult> steps = new ArrayList<>();
    private boolean aborted;
    private long elapsedMillis;

    public synchronized void addStep(StepResult step) {
        steps.add(step);
    }

    public synchronized List<StepResult> getSteps() {
        return new ArrayList<>(steps);
    }

    public synchronized void markAborted() {
        this.aborted = true;
    }

    public synchronized boolean isAborted() {
        return aborted;
    }

    public synchronized RunOutcome getOutcome() {
        RunOutcome outcome = aborted ? RunOutcome.FATAL_FAILURE : RunOutcome.SUCCESS;
        for (StepResult step : steps) {
            outcome = outcome.combine(step.getOutcome());
        }
        return outcome;
    }

    public int getExitCode() {
        return getOutcome().getExitCode();
    }

    public synchronized int getTotalFailures() {
        return steps.stream().mapToInt(StepResult::getFailureCount).sum();
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public synchronized long getElapsedMillis() {
        return elapsedMillis;
    }

    public synchronized void setElapsedMillis(long elapsedMillis) {
        this.elapsedMillis = elapsedMillis;
    }

    @Override
    public synchronized String toString() {
        return String.format("MigrationRunResult{outcome=%s, steps=%d, failures=%d, aborted=%s, elapsed=%dms}",
                getOutcome(), steps.size(), getTotalFailures(), aborted, elapsedMillis);
    }
}
