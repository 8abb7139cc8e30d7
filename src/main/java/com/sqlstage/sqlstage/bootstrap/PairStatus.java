package com.sqlstage.sqlstage.bootstrap;

/**
 * Result of one engine/dataset pair in a bootstrap run.
 */
public enum PairStatus {
    IMPORTED,
    NO_SOURCE,
    RESOLUTION_FAILED,
    DB_ADMIN_FAILED,
    IMPORT_FAILED,
    SKIPPED_AFTER_IMPORT_FAILURE
}
