package de.bsommerfeld.sparkle.core.domain;

/**
 * Outcome of validating a theme name or inspiration content. Callers map
 * each non-valid constant to a precise inline field error.
 */
public enum ValidationResult {

    VALID,
    EMPTY,
    TOO_LONG,
    INVALID;

    public boolean isValid() {
        return this == VALID;
    }
}
