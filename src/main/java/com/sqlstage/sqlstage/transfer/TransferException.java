package com.sqlstage.sqlstage.transfer;

import com.sqlstage.sqlstage.asset.AssetResolutionException;

/**
 * Thrown when a remote fetch fails. Carries the HTTP status, or {@link #NO_STATUS} when no response arrived.
 */
public class TransferException extends AssetResolutionException {

    public static final int NO_STATUS = -1;

    private final int statusCode;

    public TransferException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransferException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
