package me.christianrobert.mspgsync.core.job.model.script;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversion outcome of one script file.
 */
public class FileConversionResult {

    private final String fileName;
    private final boolean success;
    private final String convertedText;
    private final List<String> statementGroups;
    private final List<AppliedChange> changes;
    private final List<String> warnings;
    private final String error;

    private FileConversionResult(String fileName, boolean success, String convertedText, List<String> statementGroups,
                                 List<AppliedChange> changes, List<String> warnings, String error) {
        this.fileName = fileName;
        this.success = success;
        this.convertedText = convertedText;
        this.statementGroups = List.copyOf(statementGroups);
        this.changes = List.copyOf(changes);
        this.warnings = List.copyOf(warnings);
        this.error = error;
    }

    public static FileConversionResult converted(String fileName, String convertedText, List<String> statementGroups,
                                                 List<AppliedChange> changes, List<String> warnings) {
        return new FileConversionResult(fileName, true, convertedText, statementGroups, changes, warnings, null);
    }

    public static FileConversionResult failed(String fileName, String error) {
        return new FileConversionResult(fileName, false, null, new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), error);
    }

    public String getFileName() {
        return fileName;
    }

    public boolean isSuccess() {
        return success;
    }

    @JsonIgnore
    public String getConvertedText() {
        return convertedText;
    }

    /**
     * Converted text of each batch, in script order.
     */
    @JsonIgnore
    public List<String> getStatementGroups() {
        return statementGroups;
    }

    public int getStatementGroupCount() {
        return statementGroups.size();
    }

    public List<AppliedChange> getChanges() {
        return changes;
    }

    public int getChangeCount() {
        return changes.size();
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return success
                ? String.format("FileConversionResult{%s, changes=%d}", fileName, changes.size())
                : String.format("FileConversionResult{%s, failed: %s}", fileName, error);
    }
}
