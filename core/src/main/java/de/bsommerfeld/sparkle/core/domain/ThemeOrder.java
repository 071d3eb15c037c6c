package de.bsommerfeld.sparkle.core.domain;

/**
 * Sort orders supported when listing themes. Ties are always broken by name
 * so that listings are stable.
 */
public enum ThemeOrder {

    NAME_ASC,
    LAST_USED_DESC,
    INSPIRATION_COUNT_DESC
}
