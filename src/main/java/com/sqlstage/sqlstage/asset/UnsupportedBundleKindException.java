package com.sqlstage.sqlstage.asset;

/**
 * Thrown when a bundle declares an archive type other than tar-gzip.
 */
public class UnsupportedBundleKindException extends AssetResolutionException {

    public UnsupportedBundleKindException(String message) {
        super(message);
    }

    public UnsupportedBundleKindException(String message, Throwable cause) {
        super(message, cause);
    }
}
