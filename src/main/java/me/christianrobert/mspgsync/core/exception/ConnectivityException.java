package me.christianrobert.mspgsync.core.exception;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Source or target database is unreachable.
 * Retried with bounded attempts during data transfer, fatal immediately for introspection and DDL.
 */
public class ConnectivityException extends MigrationException {

    private final String database;

    public ConnectivityException(String database, String message, Throwable cause) {
        super(String.format("%s unreachable: %s", database, message), cause);
        this.database = database;
    }

    public String getDatabase() {
        return database;
    }

    /**
     * SQLState class 08 is "connection exception" in both drivers.
     */
    public static boolean isTransient(SQLException e) {
        SQLException current = e;
        while (current != null) {
            String sqlState = current.getSQLState();
            if (sqlState != null && sqlState.startsWith("08")) {
                return true;
            }
            if (current instanceof SQLTransientException
                    || current instanceof SQLRecoverableException) {
                return true;
            }
            current = current.getNextException();
        }
        return false;
    }
}
