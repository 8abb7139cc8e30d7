package com.sqlstage.sqlstage.asset;

/**
 * Thrown when a dataset references a bundle id that is not configured.
 */
public class UnknownBundleException extends AssetResolutionException {

    public UnknownBundleException(String message) {
        super(message);
    }

    public UnknownBundleException(String message, Throwable cause) {
        super(message, cause);
    }
}
