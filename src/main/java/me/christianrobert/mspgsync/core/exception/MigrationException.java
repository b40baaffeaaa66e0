package me.christianrobert.mspgsync.core.exception;

/**
 * Base class of all migration failures.
 * Subclasses name the failure category so callers can decide whether it is fatal for
 * the unit (table, constraint, file), the step, or the whole run.
 */
public abstract class MigrationException extends RuntimeException {

    protected MigrationException(String message) {
        super(message);
    }

    protected MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
