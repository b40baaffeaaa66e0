package me.christianrobert.mspgsync.core.job.model;

/**
 * Exit signal of a step or a whole run.
 */
public enum RunOutcome {
    SUCCESS(0),
    PARTIAL_SUCCESS(1),
    FATAL_FAILURE(2);

    private final int exitCode;

    RunOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }

    /**
     * Returns the more severe of both outcomes.
     */
    public RunOutcome combine(RunOutcome other) {
        if (other == null) {
            return this;
        }
        return other.exitCode > this.exitCode ? other : this;
    }

    public static RunOutcome of(int failureCount) {
        return failureCount == 0 ? SUCCESS : PARTIAL_SUCCESS;
    }
}
