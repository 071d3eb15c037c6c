package de.bsommerfeld.sparkle.db;

/**
 * Outcome of a coordinator operation: either a value or a {@link StoreError}.
 * Expected failures such as validation errors are reported through this type
 * and never thrown.
 */
public record StoreResult<T>(T value, StoreError error) {

    public static <T> StoreResult<T> success(T value) {
        return new StoreResult<>(value, null);
    }

    public static <T> StoreResult<T> failure(StoreError error) {
        return new StoreResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T getOrThrow() {
        if (error != null)
            throw new IllegalStateException("Operation failed: " + error.message());
        return value;
    }

    public ErrorKind errorKind() {
        return error == null ? null : error.kind();
    }
}
