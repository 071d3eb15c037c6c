package de.bsommerfeld.sparkle.db;

/**
 * Tables of the normalized schema. Write units record which of these they
 * touched so that only the affected live queries re-run after commit.
 */
public enum Table {

    THEMES("themes"),
    INSPIRATIONS("inspirations");

    private final String sqlName;

    Table(String sqlName) {
        this.sqlName = sqlName;
    }

    public String sqlName() {
        return sqlName;
    }
}
