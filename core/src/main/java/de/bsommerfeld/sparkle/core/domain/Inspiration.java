package de.bsommerfeld.sparkle.core.domain;

/**
 * A single short note. Every inspiration belongs to exactly one
 * {@link Theme}, referenced by name.
 *
 * @param id        store-assigned id, {@code 0} before the first insert
 * @param content   note text, 1–500 characters
 * @param themeName name of the owning theme
 * @param createdAt creation timestamp in epoch milliseconds
 * @param wordCount word count as computed by the caller; the store does not
 *                  recompute it
 */
public record Inspiration(
        long id,
        String content,
        String themeName,
        long createdAt,
        int wordCount) {

    public static final int MAX_CONTENT_LENGTH = 500;

    /**
     * Convenience constructor for a not-yet-persisted inspiration.
     */
    public Inspiration(String content, String themeName, long createdAt, int wordCount) {
        this(0, content, themeName, createdAt, wordCount);
    }

    public ValidationResult validateContent() {
        return validateContent(content);
    }

    public static ValidationResult validateContent(String content) {
        if (content == null || content.isBlank())
            return ValidationResult.EMPTY;
        if (content.length() > MAX_CONTENT_LENGTH)
            return ValidationResult.TOO_LONG;
        return ValidationResult.VALID;
    }

    public Inspiration withThemeName(String newThemeName) {
        return new Inspiration(id, content, newThemeName, createdAt, wordCount);
    }
}
