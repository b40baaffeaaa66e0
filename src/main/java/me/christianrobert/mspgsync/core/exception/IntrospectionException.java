package me.christianrobert.mspgsync.core.exception;

/**
 * Reading the source catalog failed (connectivity or permissions). Fatal for the run.
 */
public class IntrospectionException extends MigrationException {

    public IntrospectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
