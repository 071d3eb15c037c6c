package de.bsommerfeld.sparkle.db;

import de.bsommerfeld.sparkle.core.domain.ValidationResult;

/**
 * Describes why a store operation was rejected.
 *
 * @param kind       failure category
 * @param message    human-readable detail, suitable for logs
 * @param validation the specific validation outcome for {@code INVALID_NAME}
 *                   and {@code INVALID_CONTENT}, {@code null} otherwise
 */
public record StoreError(ErrorKind kind, String message, ValidationResult validation) {

    public static StoreError invalidName(String name, ValidationResult validation) {
        return new StoreError(ErrorKind.INVALID_NAME,
                "Invalid theme name '" + name + "': " + validation, validation);
    }

    public static StoreError invalidContent(ValidationResult validation) {
        return new StoreError(ErrorKind.INVALID_CONTENT, "Invalid inspiration content: " + validation, validation);
    }

    public static StoreError duplicateKey(String themeName) {
        return new StoreError(ErrorKind.DUPLICATE_KEY, "Theme '" + themeName + "' already exists", null);
    }

    public static StoreError themeNotFound(String themeName) {
        return new StoreError(ErrorKind.NOT_FOUND, "Theme '" + themeName + "' does not exist", null);
    }

    public static StoreError inspirationNotFound(long id) {
        return new StoreError(ErrorKind.NOT_FOUND, "Inspiration " + id + " does not exist", null);
    }

    public static StoreError protectedTheme(String themeName) {
        return new StoreError(ErrorKind.PROTECTED_THEME, "Theme '" + themeName + "' is the default theme", null);
    }

    public static StoreError storage(String message) {
        return new StoreError(ErrorKind.STORAGE_FAILURE, message, null);
    }
}
