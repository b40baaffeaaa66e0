package me.christianrobert.mspgsync.core.job.model.script;

import me.christianrobert.mspgsync.core.job.model.MigrationStepResult;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Summary of converting a directory of scripts. Files are converted concurrently,
 * results are kept in file name order.
 */
public class ScriptConversionResult implements MigrationStepResult {

    private final String sourceDirectory;
    private final String targetDirectory;
    private final List<FileConversionResult> files = new ArrayList<>();
    private final LocalDateTime executionDateTime = LocalDateTime.now();
    private String reportPath;

    public ScriptConversionResult(String sourceDirectory, String targetDirectory) {
        this.sourceDirectory = sourceDirectory;
        this.targetDirectory = targetDirectory;
    }

    public synchronized void addFile(FileConversionResult file) {
        files.add(file);
        files.sort(Comparator.comparing(FileConversionResult::getFileName));
    }

    public String getSourceDirectory() {
        return sourceDirectory;
    }

    public String getTargetDirectory() {
        return targetDirectory;
    }

    public synchronized List<FileConversionResult> getFiles() {
        return new ArrayList<>(files);
    }

    public synchronized int getConverted() {
        return (int) files.stream().filter(FileConversionResult::isSuccess).count();
    }

    public synchronized int getFailed() {
        return files.size() - getConverted();
    }

    public synchronized int getTotalChanges() {
        return files.stream().mapToInt(FileConversionResult::getChangeCount).sum();
    }

    public String getReportPath() {
        return reportPath;
    }

    public void setReportPath(String reportPath) {
        this.reportPath = reportPath;
    }

    public LocalDateTime getExecutionDateTime() {
        return executionDateTime;
    }

    @Override
    public int getSuccessCount() {
        return getConverted();
    }

    @Override
    public int getFailureCount() {
        return getFailed();
    }

    @Override
    public synchronized List<String> getFailureMessages() {
        List<String> messages = new ArrayList<>();
        for (FileConversionResult file : files) {
            if (!file.isSuccess()) {
                messages.add(file.getFileName() + ": " + file.getError());
            }
        }
        return messages;
    }

    @Override
    public String toString() {
        return String.format("ScriptConversionResult{converted=%d, failed=%d, total_changes=%d}",
                getConverted(), getFailed(), getTotalChanges());
    }
}
