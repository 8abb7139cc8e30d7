package com.sqlstage.sqlstage.archive;

import com.sqlstage.sqlstage.asset.AssetResolutionException;

/**
 * Thrown when an archive cannot be read to the end or contains unsafe entries.
 */
public class ArchiveCorruptException extends AssetResolutionException {

    public ArchiveCorruptException(String message) {
        super(message);
    }

    public ArchiveCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
