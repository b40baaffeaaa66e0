package me.christianrobert.mspgsync.script.job;

import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.core.job.AbstractDatabaseWriteJob;
import me.christianrobert.mspgsync.core.job.model.JobProgress;
import me.christianrobert.mspgsync.core.job.model.script.ScriptConversionResult;
import me.christianrobert.mspgsync.script.service.ScriptConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Converts a directory of T-SQL scripts. Needs no database connection; the directories are
 * set by the caller before the job is submitted.
 */
@Dependent
public class ScriptConversionJob extends AbstractDatabaseWriteJob<ScriptConversionResult> {

    private static final Logger log = LoggerFactory.getLogger(ScriptConversionJob.class);

    @Inject
    ScriptConversionService scriptConversionService;

    private Path sourceDirectory;
    private Path targetDirectory;

    public void setDirectories(Path sourceDirectory, Path targetDirectory) {
        this.sourceDirectory = sourceDirectory;
        this.targetDirectory = targetDirectory;
    }

    @Override
    public String getTargetDatabase() {
        return "FILESYSTEM";
    }

    @Override
    public String getWriteOperationType() {
        return "SCRIPT_CONVERSION";
    }

    @Override
    public Class<ScriptConversionResult> getResultType() {
        return ScriptConversionResult.class;
    }

    @Override
    protected void saveResultsToState(ScriptConversionResult result) {
        stateService.setScriptConversionResult(result);
    }

    @Override
    protected ScriptConversionResult performWriteOperation(Consumer<JobProgress> progressCallback) throws Exception {
        if (sourceDirectory == null || targetDirectory == null) {
            throw new IllegalStateException("Source and target directory must be set before running the conversion");
        }
        updateProgress(progressCallback, 0, "Initializing",
                String.format("Converting scripts from %s to %s", sourceDirectory, targetDirectory));

        AtomicInteger done = new AtomicInteger();
        ScriptConversionResult result = scriptConversionService.convertDirectory(sourceDirectory, targetDirectory,
                this::isCancellationRequested,
                file -> updateProgress(progressCallback, Math.min(85, 5 + done.incrementAndGet()),
                        "Converted " + file.getFileName(),
                        file.isSuccess() ? file.getChangeCount() + " changes" : "Failed: " + file.getError()));

        if (isCancellationRequested()) {
            log.info("Script conversion cancelled after {} files", result.getFiles().size());
        }
        return result;
    }

    @Override
    protected String generateSummaryMessage(ScriptConversionResult result) {
        return String.format("Script conversion completed: %d converted, %d failed, %d total changes",
                result.getConverted(), result.getFailed(), result.getTotalChanges());
    }
}
