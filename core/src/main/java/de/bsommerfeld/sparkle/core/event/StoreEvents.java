package de.bsommerfeld.sparkle.core.event;

import java.util.Collection;
import java.util.Set;

/**
 * Events published by the note store on the {@link ApplicationEventBus}.
 */
public class StoreEvents {

    /**
     * Posted after a write transaction commits. {@code tables} holds the names
     * of every table the transaction modified.
     */
    public record TablesChangedEvent(Set<String> tables) {

        public TablesChangedEvent {
            tables = Set.copyOf(tables);
        }

        public boolean touchesAny(Collection<String> names) {
            for (String name : names) {
                if (tables.contains(name))
                    return true;
            }
            return false;
        }
    }

    /**
     * Posted when refreshing a theme's cached aggregates failed. The
     * triggering mutation has already been committed at that point.
     */
    public record AggregateRefreshFailedEvent(String themeName, String reason) {
    }
}
