package com.sqlstage.sqlstage.db;

/**
 * Base type for non-zero exits of the database engine command-line tools.
 */
public class DbCommandException extends RuntimeException {

    public DbCommandException(String message) {
        super(message);
    }

    public DbCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
