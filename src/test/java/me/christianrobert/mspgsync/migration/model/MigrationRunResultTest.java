package me.christianrobert.mspgsync.migration.model;

import me.christianrobert.mspgsync.core.job.model.RunOutcome;
import me.christianrobert.mspgsync.core.job.model.table.TableCreationResult;
import me.christianrobert.mspgsync.core.job.model.transfer.DataTransferResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MigrationRunResultTest {

    @Test
    void completedStep_sumsCountsOfItsJobs() {
        TableCreationResult tables = new TableCreationResult();
        tables.addCreatedTable("public.Orders");
        tables.addCreatedTable("public.Customers");
        DataTransferResult transfer = new DataTransferResult();
        transfer.addTransferredTable("public.Orders", 5);
        transfer.addError("public.Customers", 0, "boom");

        StepResult step = StepResult.completed(1, "Schema and data", List.of(tables, transfer), 12);

        assertEquals(3, step.getSuccessCount());
        assertEquals(1, step.getFailureCount());
        assertEquals(RunOutcome.PARTIAL_SUCCESS, step.getOutcome());
        assertEquals("Step 1 (Schema and data): PARTIAL_SUCCESS, 3 succeeded, 1 failed in 12 ms", step.toString());
    }

    @Test
    void emptyRunSucceeds() {
        MigrationRunResult run = new MigrationRunResult();

        assertEquals(RunOutcome.SUCCESS, run.getOutcome());
        assertEquals(0, run.getExitCode());
    }

    @Test
    void worstStepDecidesOutcome() {
        MigrationRunResult run = new MigrationRunResult();
        run.addStep(StepResult.skipped(4, "Collations", "disabled"));
        run.addStep(StepResult.fatal(3, "Constraints and indexes", "cycle", 3));

        assertEquals(RunOutcome.FATAL_FAILURE, run.getOutcome());
        assertEquals(1, run.getTotalFailures());
    }

    @Test
    void abortedRunIsFatal() {
        MigrationRunResult run = new MigrationRunResult();
        run.markAborted();

        assertEquals(2, run.getExitCode());
    }

    @Test
    void combine_keepsMoreSevereOutcome() {
        assertEquals(RunOutcome.PARTIAL_SUCCESS, RunOutcome.SUCCESS.combine(RunOutcome.PARTIAL_SUCCESS));
        assertEquals(RunOutcome.FATAL_FAILURE, RunOutcome.FATAL_FAILURE.combine(RunOutcome.SUCCESS));
        assertEquals(RunOutcome.SUCCESS, RunOutcome.SUCCESS.combine(null));
    }
}
