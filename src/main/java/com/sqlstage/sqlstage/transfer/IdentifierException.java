package com.sqlstage.sqlstage.transfer;

import com.sqlstage.sqlstage.asset.AssetResolutionException;

/**
 * Thrown when no file identifier can be read from an interactive-host URL.
 */
public class IdentifierException extends AssetResolutionException {

    public IdentifierException(String message) {
        super(message);
    }

    public IdentifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
