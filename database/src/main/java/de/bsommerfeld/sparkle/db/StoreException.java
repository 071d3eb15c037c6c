package de.bsommerfeld.sparkle.db;

/**
 * Thrown by the catalog and store components to reject an operation. Being
 * unchecked, it unwinds out of the enclosing {@link SqlWork} and rolls the
 * write unit back. {@link IntegrityCoordinator} turns it into a
 * {@link StoreResult}.
 */
public class StoreException extends RuntimeException {

    private final StoreError error;

    public StoreException(StoreError error) {
        super(error.message());
        this.error = error;
    }

    public StoreException(StoreError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public StoreError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.kind();
    }
}
