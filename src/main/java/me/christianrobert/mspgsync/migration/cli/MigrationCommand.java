package me.christianrobert.mspgsync.migration.cli;

import me.christianrobert.mspgsync.core.job.model.RunOutcome;
import me.christianrobert.mspgsync.core.job.model.script.FileConversionResult;
import me.christianrobert.mspgsync.core.job.model.script.ScriptConversionResult;
import me.christianrobert.mspgsync.migration.model.MigrationRunResult;
import me.christianrobert.mspgsync.migration.model.StepResult;
import me.christianrobert.mspgsync.migration.service.MigrationRunService;
import me.christianrobert.mspgsync.script.service.ScriptConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command line entry points. Exit codes: 0 success, 1 success with recorded failures,
 * 2 fatal failure.
 */
@Command(
        name = "mspgsync",
        mixinStandardHelpOptions = true,
        version = "mspgsync 1.0.0",
        description = "Migrates a SQL Server database to PostgreSQL and converts T-SQL scripts."
)
public class MigrationCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MigrationCommand.class);

    private final MigrationRunService migrationRunService;
    private final ScriptConversionService scriptConversionService;

    public MigrationCommand(MigrationRunService migrationRunService, ScriptConversionService scriptConversionService) {
        this.migrationRunService = migrationRunService;
        this.scriptConversionService = scriptConversionService;
    }

    public CommandLine commandLine() {
        return new CommandLine(this)
                .addSubcommand("run-all", new RunAllCommand())
                .addSubcommand("step", new StepCommand())
                .addSubcommand("convert-scripts", new ConvertScriptsCommand());
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return RunOutcome.SUCCESS.getExitCode();
    }

    private int report(MigrationRunResult run) {
        for (StepResult step : run.getSteps()) {
            log.info("{}", step);
            for (String failure : step.getFailures()) {
                log.warn("  step {}: {}", step.getStepNumber(), failure);
            }
        }
        log.info("Migration finished with outcome {} (exit code {})", run.getOutcome(), run.getExitCode());
        return run.getExitCode();
    }

    @Command(name = "run-all", description = "Runs steps 1-4 in order.")
    class RunAllCommand implements Callable<Integer> {

        @Override
        public Integer call() {
            return report(migrationRunService.runAll(progress ->
                    log.debug("{}% {}", progress.getPercentage(), progress.getCurrentTask())));
        }
    }

    @Command(name = "step", description = "Runs a single step: 1 schema and data, 2 verification, "
            + "3 constraints and indexes, 4 collations.")
    class StepCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Step number (1-4)")
        int step;

        @Override
        public Integer call() {
            if (step < MigrationRunService.FIRST_STEP || step > MigrationRunService.LAST_STEP) {
                log.error("Step must be between {} and {}, got {}",
                        MigrationRunService.FIRST_STEP, MigrationRunService.LAST_STEP, step);
                return RunOutcome.FATAL_FAILURE.getExitCode();
            }
            return report(migrationRunService.runStep(step, progress ->
                    log.debug("{}% {}", progress.getPercentage(), progress.getCurrentTask())));
        }
    }

    @Command(name = "convert-scripts", description = "Converts all *.sql files of a directory to PostgreSQL.")
    class ConvertScriptsCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Directory with T-SQL scripts")
        Path sourceDirectory;

        @Parameters(index = "1", description = "Directory for the converted scripts")
        Path targetDirectory;

        @Override
        public Integer call() {
            try {
                ScriptConversionResult result = scriptConversionService.convertDirectory(
                        sourceDirectory, targetDirectory, () -> false, null);
                for (FileConversionResult file : result.getFiles()) {
                    if (!file.isSuccess()) {
                        log.warn("  {} failed: {}", file.getFileName(), file.getError());
                    }
                }
                log.info("Script conversion finished: {} converted, {} failed, {} total changes",
                        result.getConverted(), result.getFailed(), result.getTotalChanges());
                return result.getOutcome().getExitCode();
            } catch (IOException e) {
                log.error("Script conversion failed: {}", e.getMessage());
                return RunOutcome.FATAL_FAILURE.getExitCode();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Script conversion interrupted");
                return RunOutcome.FATAL_FAILURE.getExitCode();
            }
        }
    }
}
