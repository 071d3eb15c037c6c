package de.bsommerfeld.sparkle.db;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.sparkle.core.event.ApplicationEventBus;
import de.bsommerfeld.sparkle.core.event.StoreEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * A query whose result callers can observe over time.
 *
 * <p>
 * {@link #subscribe} delivers the current snapshot immediately and a fresh
 * snapshot after every committed write unit that touched one of the tables
 * the query depends on. Snapshots are re-read from the database each time;
 * nothing is cached. Subscribing again restarts the sequence from the
 * current state.
 *
 * <p>
 * Re-emission runs on the thread that committed the write, which for the
 * note store is its single writer thread. Consumers that do heavy work
 * should hand off to their own executor.
 */
public class LiveQuery<T> {

    private static final Logger LOG = LoggerFactory.getLogger(LiveQuery.class);

    private final ApplicationEventBus eventBus;
    private final Supplier<T> query;
    private final Set<String> tableNames;

    LiveQuery(ApplicationEventBus eventBus, Supplier<T> query, Set<Table> tables) {
        this.eventBus = eventBus;
        this.query = query;
        this.tableNames = tables.stream().map(Table::sqlName).collect(Collectors.toUnmodifiableSet());
    }

    /** Runs the query once and returns the current snapshot. */
    public T get() {
        return query.get();
    }

    /**
     * Starts observing. The consumer is invoked once before this method
     * returns, then again after each relevant commit until the returned
     * subscription is closed.
     */
    public Subscription subscribe(Consumer<? super T> consumer) {
        Listener listener = new Listener(consumer);
        // register first so a commit racing the initial read is not missed
        eventBus.register(listener);
        listener.emit();
        return listener::close;
    }

    private final class Listener {

        private final Consumer<? super T> consumer;
        private final AtomicBoolean closed = new AtomicBoolean();

        private Listener(Consumer<? super T> consumer) {
            this.consumer = consumer;
        }

        @Subscribe
        public void onTablesChanged(StoreEvents.TablesChangedEvent event) {
            if (!closed.get() && event.touchesAny(tableNames))
                emit();
        }

        private void emit() {
            T snapshot;
            try {
                snapshot = query.get();
            } catch (StoreException e) {
                LOG.warn("Live query on {} failed, keeping subscription open: {}", tableNames, e.getMessage());
                return;
            }
            if (!closed.get())
                consumer.accept(snapshot);
        }

        private void close() {
            if (closed.compareAndSet(false, true))
                eventBus.unregister(this);
        }
    }
}
