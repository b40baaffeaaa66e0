package me.christianrobert.mspgsync.core.exception;

/**
 * A script cannot be rewritten safely, for example because of an unterminated literal.
 * Scoped to one file; the directory conversion continues.
 */
public class ScriptConversionException extends MigrationException {

    private final int line;
    private final int column;

    public ScriptConversionException(String message, int line, int column) {
        super(String.format("%s at line %d, column %d", message, line, column));
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
