package com.sqlstage.sqlstage.db;

/**
 * Thrown when the structure-only dump fails. Reported, never fatal.
 */
public class SchemaDumpException extends DbCommandException {

    public SchemaDumpException(String message) {
        super(message);
    }

    public SchemaDumpException(String message, Throwable cause) {
        super(message, cause);
    }
}
