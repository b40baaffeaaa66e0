package me.christianrobert.mspgsync.migration.service;

import me.christianrobert.mspgsync.core.exception.ConnectivityException;
import me.christianrobert.mspgsync.core.exception.CyclicConstraintException;
import me.christianrobert.mspgsync.core.job.DatabaseWriteJob;
import me.christianrobert.mspgsync.core.job.model.RunOutcome;
import me.christianrobert.mspgsync.core.job.model.collation.CollationMigrationResult;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintCreationResult;
import me.christianrobert.mspgsync.core.job.model.table.TableCreationResult;
import me.christianrobert.mspgsync.core.job.model.transfer.DataTransferResult;
import me.christianrobert.mspgsync.core.job.model.verification.VerificationReport;
import me.christianrobert.mspgsync.core.job.service.JobRegistry;
import me.christianrobert.mspgsync.core.service.StateService;
import me.christianrobert.mspgsync.migration.model.MigrationRunResult;
import me.christianrobert.mspgsync.migration.model.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for MigrationRunService.
 *
 * Purpose: steps run in order, a fatal step stops the run except a foreign key cycle in the
 * constraint step, and the run outcome maps to the exit codes 0, 1 and 2.
 */
class MigrationRunServiceTest {

    private JobRegistry jobRegistry;
    private StateService stateService;
    private MigrationRunService service;

    @BeforeEach
    void setUp() {
        jobRegistry = mock(JobRegistry.class);
        stateService = mock(StateService.class);

        service = new MigrationRunService();
        service.jobRegistry = jobRegistry;
        service.stateService = stateService;

        givenJob("TABLE_CREATION", CompletableFuture.completedFuture(new TableCreationResult()));
        givenJob("DATA_TRANSFER", CompletableFuture.completedFuture(new DataTransferResult()));
        givenJob("COLUMN_VERIFICATION", CompletableFuture.completedFuture(new VerificationReport()));
        givenJob("CONSTRAINT_CREATION", CompletableFuture.completedFuture(new ConstraintCreationResult()));
        givenJob("COLLATION_MIGRATION", CompletableFuture.completedFuture(new CollationMigrationResult()));
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private DatabaseWriteJob givenJob(String operation, CompletableFuture<?> outcome) {
        DatabaseWriteJob job = mock(DatabaseWriteJob.class);
        doReturn(outcome).when(job).execute(any());
        doReturn(Optional.of(job)).when(jobRegistry).createJob("POSTGRES", operation);
        return job;
    }

    // ========== Full run ==========

    @Test
    void runAll_allStepsSucceed() {
        MigrationRunResult run = service.runAll(progress -> { });

        assertEquals(4, run.getSteps().size());
        assertEquals(List.of(1, 2, 3, 4), run.getSteps().stream().map(StepResult::getStepNumber).toList());
        assertEquals(RunOutcome.SUCCESS, run.getOutcome());
        assertEquals(0, run.getExitCode());
        assertFalse(run.isAborted());
        verify(stateService).resetRunState();
    }

    @Test
    void runAll_partialFailuresGiveExitCodeOne() {
        DataTransferResult transfer = new DataTransferResult();
        transfer.addTransferredTable("public.Orders", 10);
        transfer.addError("public.Notes", 0, "invalid byte sequence");
        givenJob("DATA_TRANSFER", CompletableFuture.completedFuture(transfer));

        MigrationRunResult run = service.runAll(progress -> { });

        assertEquals(4, run.getSteps().size());
        assertEquals(RunOutcome.PARTIAL_SUCCESS, run.getSteps().get(0).getOutcome());
        assertEquals(List.of("public.Notes: invalid byte sequence"), run.getSteps().get(0).getFailures());
        assertEquals(1, run.getExitCode());
    }

    @Test
    void runAll_fatalFirstStepAbortsRun() {
        givenJob("TABLE_CREATION", CompletableFuture.failedFuture(
                new ConnectivityException("MSSQL", "login failed", new SQLException("login failed", "08001"))));

        MigrationRunResult run = service.runAll(progress -> { });

        assertEquals(1, run.getSteps().size());
        assertTrue(run.isAborted());
        assertEquals(RunOutcome.FATAL_FAILURE, run.getOutcome());
        assertEquals(2, run.getExitCode());
        verify(jobRegistry, never()).createJob("POSTGRES", "DATA_TRANSFER");
        verify(jobRegistry, never()).createJob("POSTGRES", "COLUMN_VERIFICATION");
    }

    @Test
    void runAll_foreignKeyCycleDoesNotStopCollations() {
        givenJob("CONSTRAINT_CREATION", CompletableFuture.failedFuture(
                new CyclicConstraintException(List.of(List.of("dbo.a", "dbo.b")))));

        MigrationRunResult run = service.runAll(progress -> { });

        assertEquals(4, run.getSteps().size());
        assertFalse(run.isAborted());
        StepResult constraints = run.getSteps().get(2);
        assertEquals(RunOutcome.FATAL_FAILURE, constraints.getOutcome());
        assertTrue(constraints.getFailures().get(0).contains("dbo.a <-> dbo.b"));
        assertEquals(2, run.getExitCode());
        verify(jobRegistry).createJob("POSTGRES", "COLLATION_MIGRATION");
    }

    @Test
    void runAll_skippedCollationsAreReportedAsSkipped() {
        CollationMigrationResult skipped = new CollationMigrationResult();
        skipped.markSkipped();
        givenJob("COLLATION_MIGRATION", CompletableFuture.completedFuture(skipped));

        MigrationRunResult run = service.runAll(progress -> { });

        StepResult collations = run.getSteps().get(3);
        assertTrue(collations.isSkipped());
        assertEquals(RunOutcome.SUCCESS, collations.getOutcome());
        assertEquals(0, run.getExitCode());
    }

    // ========== Single step ==========

    @Test
    void runStep_runsOnlyThatStep() {
        MigrationRunResult run = service.runStep(2, progress -> { });

        assertEquals(1, run.getSteps().size());
        assertEquals("Verification", run.getSteps().get(0).getStepName());
        verify(jobRegistry, never()).createJob("POSTGRES", "TABLE_CREATION");
        verify(stateService, never()).resetRunState();
    }

    @Test
    void runStep_rejectsUnknownStep() {
        assertThrows(IllegalArgumentException.class, () -> service.runStep(5, progress -> { }));
        assertThrows(IllegalArgumentException.class, () -> service.runStep(0, progress -> { }));
    }

    @Test
    void runStep_missingJobIsFatal() {
        doReturn(Optional.empty()).when(jobRegistry).createJob(eq("POSTGRES"), eq("COLUMN_VERIFICATION"));

        MigrationRunResult run = service.runStep(2, progress -> { });

        assertEquals(RunOutcome.FATAL_FAILURE, run.getOutcome());
        assertTrue(run.isAborted());
    }

    @Test
    void operations_stepOneCreatesTablesBeforeLoadingData() {
        assertEquals(List.of("TABLE_CREATION", "DATA_TRANSFER"), MigrationRunService.operations(1));
        assertEquals(List.of("COLLATION_MIGRATION"), MigrationRunService.operations(4));
    }
}
