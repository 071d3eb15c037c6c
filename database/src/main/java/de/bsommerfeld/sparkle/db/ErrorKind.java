package de.bsommerfeld.sparkle.db;

/**
 * Failure categories reported by the store.
 */
public enum ErrorKind {

    /** Theme name blank, too long or containing the legacy marker. */
    INVALID_NAME,
    /** Inspiration content blank or too long. */
    INVALID_CONTENT,
    DUPLICATE_KEY,
    NOT_FOUND,
    /** Attempt to delete or rename the default theme. */
    PROTECTED_THEME,
    MIGRATION_FAILURE,
    /** Cached theme aggregates could not be refreshed. Never fails the caller. */
    AGGREGATE_REFRESH_FAILURE,
    /** Unexpected SQLite error inside a write unit. */
    STORAGE_FAILURE
}
