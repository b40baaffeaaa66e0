package me.christianrobert.mspgsync.core.exception;

/**
 * No type mapping entry and no generic fallback exists for a source type.
 * Non-fatal: the column or script token is skipped with a warning.
 */
public class UnknownTypeMappingException extends MigrationException {

    private final String sourceType;

    public UnknownTypeMappingException(String sourceType) {
        super("No type mapping for source type '" + sourceType + "'");
        this.sourceType = sourceType;
    }

    public String getSourceType() {
        return sourceType;
    }
}
