package com.sqlstage.sqlstage.archive;

import com.sqlstage.sqlstage.asset.AssetResolutionException;

/**
 * Thrown when a named member is absent from an archive or an extracted tree.
 */
public class MemberNotFoundException extends AssetResolutionException {

    public MemberNotFoundException(String message) {
        super(message);
    }

    public MemberNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
