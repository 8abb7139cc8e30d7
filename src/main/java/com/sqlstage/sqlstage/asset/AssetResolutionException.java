package com.sqlstage.sqlstage.asset;

/**
 * Base type for failures while fetching, extracting or staging a dataset asset.
 */
public class AssetResolutionException extends RuntimeException {

    public AssetResolutionException(String message) {
        super(message);
    }

    public AssetResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
