package me.christianrobert.mspgsync.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.mspgsync.core.job.model.collation.CollationMigrationResult;
import me.christianrobert.mspgsync.core.job.model.script.ScriptConversionResult;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintCreationResult;
import me.christianrobert.mspgsync.core.job.model.table.TableCreationResult;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import me.christianrobert.mspgsync.core.job.model.transfer.DataTransferResult;
import me.christianrobert.mspgsync.core.job.model.verification.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds what one step produces for the steps after it: the introspected source tables, the
 * table definitions issued in step 1 and each step's result. Everything is replaced, never
 * merged, when a step runs again.
 */
@ApplicationScoped
public class StateService {

    private static final Logger log = LoggerFactory.getLogger(StateService.class);

    private volatile List<TableMetadata> sourceTableMetadata = new ArrayList<>();

    private volatile TableCreationResult tableCreationResult;
    private volatile DataTransferResult dataTransferResult;
    private volatile VerificationReport verificationReport;
    private volatile ConstraintCreationResult constraintCreationResult;
    private volatile CollationMigrationResult collationMigrationResult;
    private volatile ScriptConversionResult scriptConversionResult;

    public List<TableMetadata> getSourceTableMetadata() {
        return sourceTableMetadata;
    }

    public void setSourceTableMetadata(List<TableMetadata> sourceTableMetadata) {
        log.debug("Storing metadata of {} source tables", sourceTableMetadata.size());
        this.sourceTableMetadata = List.copyOf(sourceTableMetadata);
    }

    /**
     * Definitions of the tables created (or found existing) in step 1, in creation order.
     */
    public List<TableDefinition> getTableDefinitions() {
        TableCreationResult result = tableCreationResult;
        return result == null ? List.of() : result.getTableDefinitions();
    }

    public TableCreationResult getTableCreationResult() {
        return tableCreationResult;
    }

    public void setTableCreationResult(TableCreationResult tableCreationResult) {
        this.tableCreationResult = tableCreationResult;
    }

    public DataTransferResult getDataTransferResult() {
        return dataTransferResult;
    }

    public void setDataTransferResult(DataTransferResult dataTransferResult) {
        this.dataTransferResult = dataTransferResult;
    }

    public VerificationReport getVerificationReport() {
        return verificationReport;
    }

    public void setVerificationReport(VerificationReport verificationReport) {
        this.verificationReport = verificationReport;
    }

    public ConstraintCreationResult getConstraintCreationResult() {
        return constraintCreationResult;
    }

    public void setConstraintCreationResult(ConstraintCreationResult constraintCreationResult) {
        this.constraintCreationResult = constraintCreationResult;
    }

    public CollationMigrationResult getCollationMigrationResult() {
        return collationMigrationResult;
    }

    public void setCollationMigrationResult(CollationMigrationResult collationMigrationResult) {
        this.collationMigrationResult = collationMigrationResult;
    }

    public ScriptConversionResult getScriptConversionResult() {
        return scriptConversionResult;
    }

    public void setScriptConversionResult(ScriptConversionResult scriptConversionResult) {
        this.scriptConversionResult = scriptConversionResult;
    }

    /**
     * Clears everything a migration run produced. Script conversion results are kept since
     * that pipeline runs independently.
     */
    public void resetRunState() {
        log.info("Resetting migration run state");
        sourceTableMetadata = new ArrayList<>();
        tableCreationResult = null;
        dataTransferResult = null;
        verificationReport = null;
        constraintCreationResult = null;
        collationMigrationResult = null;
    }
}
