package com.sqlstage.sqlstage.db;

/**
 * Thrown when importing a SQL file fails; stops the remaining datasets of the engine.
 */
public class ImportFailedException extends DbCommandException {

    public ImportFailedException(String message) {
        super(message);
    }

    public ImportFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
