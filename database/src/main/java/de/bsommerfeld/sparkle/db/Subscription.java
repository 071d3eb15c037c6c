package de.bsommerfeld.sparkle.db;

/**
 * Handle to an open {@link LiveQuery} subscription. Closing it is idempotent.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
