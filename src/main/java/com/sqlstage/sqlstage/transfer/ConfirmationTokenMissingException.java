package com.sqlstage.sqlstage.transfer;

import com.sqlstage.sqlstage.asset.AssetResolutionException;

/**
 * Thrown when a confirmation page carries no usable token in links, form fields or cookies.
 */
public class ConfirmationTokenMissingException extends AssetResolutionException {

    public ConfirmationTokenMissingException(String message) {
        super(message);
    }

    public ConfirmationTokenMissingException(String message, Throwable cause) {
        super(message, cause);
    }
}
