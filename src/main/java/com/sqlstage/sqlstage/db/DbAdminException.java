package com.sqlstage.sqlstage.db;

/**
 * Thrown when the create/drop administrative command fails.
 */
public class DbAdminException extends DbCommandException {

    public DbAdminException(String message) {
        super(message);
    }

    public DbAdminException(String message, Throwable cause) {
        super(message, cause);
    }
}
