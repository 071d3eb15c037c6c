package de.bsommerfeld.sparkle.db.migration;

import de.bsommerfeld.sparkle.db.ErrorKind;

/**
 * Fatal failure while bringing the database schema to the current version.
 * The store refuses to open when this is thrown.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorKind getKind() {
        return ErrorKind.MIGRATION_FAILURE;
    }
}
