package de.bsommerfeld.sparkle.core.domain;

/**
 * A user-defined category that inspirations are filed under. The name is the
 * primary key, so renaming a theme is a cascading operation rather than a
 * plain field update.
 *
 * <p>
 * {@code lastUsed} and {@code inspirationCount} are cached aggregates. They
 * are maintained by the store after every mutation that touches the theme and
 * are never authoritative on their own.
 *
 * @param name             unique identifier, 1–50 characters
 * @param icon             display glyph, e.g. {@code 💡}
 * @param color            ARGB color value
 * @param description      free-form description, may be empty
 * @param createdAt        creation timestamp in epoch milliseconds
 * @param lastUsed         last time an inspiration was filed under this theme
 * @param inspirationCount cached number of inspirations referencing this theme
 */
public record Theme(
        String name,
        String icon,
        long color,
        String description,
        long createdAt,
        long lastUsed,
        int inspirationCount) {

    public static final int MAX_NAME_LENGTH = 50;

    /** Placeholder content used by the legacy schema to track bare themes. */
    public static final String THEME_MARKER = "__THEME_MARKER__";

    public static final String DEFAULT_ICON = "💡";
    public static final long DEFAULT_COLOR = 0xFF4A90E2L;

    /**
     * Creates a theme with default display metadata, both timestamps set to
     * {@code now} and no inspirations.
     */
    public static Theme of(String name, long now) {
        return new Theme(name, DEFAULT_ICON, DEFAULT_COLOR, "", now, now, 0);
    }

    public ValidationResult validateName() {
        return validateName(name);
    }

    /**
     * Checks a candidate theme name. A name is invalid when it contains the
     * legacy {@link #THEME_MARKER}, since such rows are discarded by the
     * schema migration.
     */
    public static ValidationResult validateName(String name) {
        if (name == null || name.isBlank())
            return ValidationResult.EMPTY;
        if (name.length() > MAX_NAME_LENGTH)
            return ValidationResult.TOO_LONG;
        if (name.contains(THEME_MARKER))
            return ValidationResult.INVALID;
        return ValidationResult.VALID;
    }

    public Theme withInspirationCount(int count) {
        return new Theme(name, icon, color, description, createdAt, lastUsed, count);
    }
}
