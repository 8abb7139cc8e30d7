package com.sqlstage.sqlstage.config;

import java.util.List;

/**
 * Shared constants for SQL asset staging and database bootstrap.
 */
public final class SqlStageConstants {

    private SqlStageConstants() {
    }

    public static final String DEFAULT_CACHE_ROOT = "data";
    public static final String DIR_ARCHIVES = "archives";
    public static final String DIR_EXTRACTED = "extracted";
    public static final String DIR_STAGED_SQL = "staged-sql";
    public static final String DIR_STAGED_QUESTIONS = "staged-questions";
    public static final String DIR_SCHEMAS = "schemas";

    public static final String EXTRACTION_MARKER = ".extracted.ok";
    public static final String PART_SUFFIX = ".part";
    public static final String SQL_EXT = ".sql";
    public static final String ZIP_EXT = ".zip";
    public static final String TGZ_EXT = ".tgz";
    public static final String QUESTIONS_SUFFIX = ".questions.txt";
    public static final String SCHEMA_SUFFIX = ".schema.sql";

    public static final int TEMP_DELETE_ATTEMPTS = 5;
    public static final long TEMP_DELETE_BACKOFF_MS = 300L;
    public static final int ZIP_ENTRY_PREVIEW_LIMIT = 20;
    public static final int COPY_BUFFER_SIZE = 1024 * 1024;

    public static final String DEFAULT_INTERACTIVE_ENDPOINT = "https://drive.google.com/uc";
    public static final List<String> DEFAULT_INTERACTIVE_HOSTS = List.of(
            "drive.google.com",
            "drive.usercontent.google.com"
    );
    public static final String CONFIRM_PARAM = "confirm";
    public static final String ID_PARAM = "id";
    public static final String DOWNLOAD_WARNING_COOKIE_PREFIX = "download_warning";
    public static final String CONTENT_TYPE_HTML = "text/html";

    public static final List<String> DEFAULT_DATASETS = List.of("academic", "imdb", "yelp", "advising", "atis");
    public static final String DEFAULT_DB_USER = "root";
    public static final String DB_CHARSET = "utf8mb4";
    public static final String DB_COLLATION = "utf8mb4_unicode_ci";
    public static final String VALID_DB_NAME_REGEX = "[A-Za-z0-9_]+";

    public static final String SOURCE_TYPE_DIRECT_SQL = "direct-sql";
    public static final String SOURCE_TYPE_ZIP = "zip";
    public static final String SOURCE_TYPE_BUNDLE = "bundle";

    public static final String MSG_HTTP_STATUS = "HTTP %d while fetching %s";
    public static final String MSG_HTTP_IO = "Transfer failed for %s";
    public static final String MSG_NO_FILE_ID = "Could not extract a file id from URL: %s";
    public static final String MSG_NO_CONFIRM_TOKEN = "Confirmation token not found for file id %s. "
            + "The resource might not be shared publicly (it must be downloadable by anyone with the link).";
    public static final String MSG_PERMISSION_DENIED = "Host returned a confirmation page again for file id %s; "
            + "the resource likely requires sign-in, which is not supported";
    public static final String MSG_ARCHIVE_CORRUPT = "Archive is corrupt or truncated: %s";
    public static final String MSG_ARCHIVE_ENTRY_ESCAPES = "Archive entry escapes extraction directory: %s";
    public static final String MSG_MEMBER_NOT_FOUND = "Member '%s' not found under: %s";
    public static final String MSG_ZIP_MEMBER_NOT_FOUND = "Member '%s' not found in zip %s. Available: %s";
    public static final String MSG_UNKNOWN_BUNDLE = "Bundle '%s' is not configured. Available: %s";
    public static final String MSG_UNSUPPORTED_BUNDLE_KIND = "Unsupported bundle type '%s' for bundle '%s'";
    public static final String MSG_CACHE_UNAVAILABLE = "Unable to create cache directory: %s";
    public static final String MSG_DB_ADMIN_FAILED = "Administrative command failed on %s (exit %d): %s";
    public static final String MSG_IMPORT_FAILED = "Import of %s into %s:%s failed (exit %d): %s";
    public static final String MSG_DUMP_FAILED = "Schema dump of %s:%s failed (exit %d): %s";
    public static final String MSG_INVALID_DB_NAME = "Invalid database name: %s";
    public static final String MSG_UNKNOWN_ENGINE = "Unknown engine '%s'. Configured: %s";
}
