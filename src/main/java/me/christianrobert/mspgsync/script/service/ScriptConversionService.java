package me.christianrobert.mspgsync.script.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.collation.service.CollationMappingService;
import me.christianrobert.mspgsync.config.service.ConfigService;
import me.christianrobert.mspgsync.core.job.model.script.FileConversionResult;
import me.christianrobert.mspgsync.core.job.model.script.ScriptConversionResult;
import me.christianrobert.mspgsync.core.tools.JsonFileStore;
import me.christianrobert.mspgsync.typemapping.service.TypeMappingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Converts every {@code *.sql} file of a directory into a target directory.
 *
 * Files are processed by a bounded worker pool; one bad file is recorded as failed and never
 * stops the others. Existing files in the target directory are overwritten but never deleted.
 */
@ApplicationScoped
public class ScriptConversionService {

    private static final Logger log = LoggerFactory.getLogger(ScriptConversionService.class);

    public static final String REPORT_FILE = "conversion-report.json";

    @Inject
    ConfigService configService;

    @Inject
    TypeMappingService typeMappingService;

    @Inject
    CollationMappingService collationMappingService;

    public ScriptRewriter createRewriter() {
        return new ScriptRewriter(
                typeMappingService.snapshot(),
                collationMappingService.snapshot(),
                configService.isEnabled(ConfigService.IDENTITY_ALWAYS),
                configService.isEnabled(ConfigService.SKIP_COLLATIONS));
    }

    /**
     * @param cancelled checked before each file; files not yet started are left out of the result
     * @param fileDone  called after each file, from the worker thread
     */
    public ScriptConversionResult convertDirectory(Path sourceDirectory, Path targetDirectory,
                                                   BooleanSupplier cancelled,
                                                   Consumer<FileConversionResult> fileDone) throws IOException, InterruptedException {
        if (!Files.isDirectory(sourceDirectory)) {
            throw new NoSuchFileException(sourceDirectory.toString(), null, "Source directory does not exist");
        }
        Files.createDirectories(targetDirectory);

        List<Path> scripts = listScripts(sourceDirectory);
        ScriptConversionResult result = new ScriptConversionResult(
                sourceDirectory.toAbsolutePath().toString(), targetDirectory.toAbsolutePath().toString());
        log.info("Converting {} scripts from {} to {}", scripts.size(), sourceDirectory, targetDirectory);

        if (!scripts.isEmpty()) {
            ScriptRewriter rewriter = createRewriter();
            int workers = Math.max(1, Math.min(
                    configService.getConfigValueAsInt(ConfigService.WORKER_THREADS, 4), scripts.size()));
            ExecutorService executor = Executors.newFixedThreadPool(workers);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (Path script : scripts) {
                    futures.add(executor.submit(() -> {
                        if (cancelled.getAsBoolean()) {
                            return;
                        }
                        FileConversionResult file = convertFile(rewriter, script, targetDirectory);
                        result.addFile(file);
                        if (fileDone != null) {
                            fileDone.accept(file);
                        }
                    }));
                }
                for (Future<?> future : futures) {
                    try {
                        future.get();
                    } catch (ExecutionException e) {
                        log.error("Unexpected failure in script conversion worker", e.getCause());
                    }
                }
            } finally {
                executor.shutdown();
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            }
        }

        writeReport(result, targetDirectory.resolve(REPORT_FILE));
        log.info("Script conversion finished: {}", result);
        return result;
    }

    FileConversionResult convertFile(ScriptRewriter rewriter, Path script, Path targetDirectory) {
        String fileName = script.getFileName().toString();
        try {
            String content = Files.readString(script, StandardCharsets.UTF_8);
            if (content.startsWith("\uFEFF")) {
                content = content.substring(1);
            }

            FileConversionResult file = rewriter.convert(fileName, content);
            if (file.isSuccess()) {
                Files.writeString(targetDirectory.resolve(fileName), file.getConvertedText(), StandardCharsets.UTF_8);
                log.info("Converted {} ({} changes, {} warnings)", fileName, file.getChangeCount(),
                        file.getWarnings().size());
            }
            return file;
        } catch (IOException e) {
            log.warn("Could not convert {}: {}", fileName, e.getMessage());
            return FileConversionResult.failed(fileName, "I/O error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error converting {}", fileName, e);
            return FileConversionResult.failed(fileName, "Unexpected error: " + e.getMessage());
        }
    }

    private List<Path> listScripts(Path sourceDirectory) throws IOException {
        try (Stream<Path> files = Files.list(sourceDirectory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".sql"))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private void writeReport(ScriptConversionResult result, Path reportFile) {
        try {
            result.setReportPath(reportFile.toAbsolutePath().toString());
            JsonFileStore.writeAtomically(reportFile, result);
        } catch (IOException e) {
            result.setReportPath(null);
            log.warn("Could not write conversion report to {}: {}", reportFile, e.getMessage());
        }
    }
}
