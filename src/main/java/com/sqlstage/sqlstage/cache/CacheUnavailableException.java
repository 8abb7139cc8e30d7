package com.sqlstage.sqlstage.cache;

/**
 * Thrown when a cache directory cannot be created. Aborts the whole run.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
