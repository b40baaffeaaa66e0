package me.christianrobert.mspgsync.core.job.model;

import java.util.List;

/**
 * Common view on the per-step result types, used to aggregate a run summary.
 */
public interface MigrationStepResult {

    int getSuccessCount();

    int getFailureCount();

    List<String> getFailureMessages();

    default RunOutcome getOutcome() {
        return RunOutcome.of(getFailureCount());
    }
}
