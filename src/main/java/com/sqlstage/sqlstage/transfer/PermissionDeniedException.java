package com.sqlstage.sqlstage.transfer;

import com.sqlstage.sqlstage.asset.AssetResolutionException;

/**
 * Thrown when the host still answers with a confirmation page after the token was sent.
 */
public class PermissionDeniedException extends AssetResolutionException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
