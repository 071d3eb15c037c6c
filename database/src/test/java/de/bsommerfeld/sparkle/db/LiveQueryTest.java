package de.bsommerfeld.sparkle.db;

import de.bsommerfeld.sparkle.core.event.ApplicationEventBus;
import de.bsommerfeld.sparkle.core.event.StoreEvents;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the subscription contract in isolation by posting change events
 * by hand.
 */
class LiveQueryTest {

    private final ApplicationEventBus eventBus = new ApplicationEventBus();
    private final AtomicInteger source = new AtomicInteger();

    private LiveQuery<Integer> query(Table... tables) {
        return new LiveQuery<>(eventBus, source::get, EnumSet.copyOf(List.of(tables)));
    }

    @Test
    void subscribe_shouldEmitCurrentSnapshotImmediately() {
        source.set(7);
        List<Integer> seen = new CopyOnWriteArrayList<>();

        query(Table.THEMES).subscribe(seen::add);

        assertEquals(List.of(7), seen);
    }

    @Test
    void subscribe_shouldReEmitOnlyForRelevantTables() {
        List<Integer> seen = new CopyOnWriteArrayList<>();
        query(Table.INSPIRATIONS).subscribe(seen::add);

        source.set(1);
        eventBus.post(new StoreEvents.TablesChangedEvent(Set.of("themes")));
        source.set(2);
        eventBus.post(new StoreEvents.TablesChangedEvent(Set.of("inspirations")));

        assertEquals(List.of(0, 2), seen);
    }

    @Test
    void close_shouldStopDeliveryAndBeIdempotent() {
        List<Integer> seen = new CopyOnWriteArrayList<>();
        Subscription subscription = query(Table.THEMES).subscribe(seen::add);

        subscription.close();
        subscription.close();
        eventBus.post(new StoreEvents.TablesChangedEvent(Set.of("themes")));

        assertEquals(List.of(0), seen);
    }

    @Test
    void subscribe_failingQuery_shouldKeepSubscriptionOpen() {
        List<Integer> seen = new CopyOnWriteArrayList<>();
        AtomicInteger calls = new AtomicInteger();
        LiveQuery<Integer> flaky = new LiveQuery<>(eventBus, () -> {
            if (calls.incrementAndGet() == 2)
                throw new StoreException(StoreError.storage("locked"));
            return calls.get();
        }, EnumSet.of(Table.THEMES));

        flaky.subscribe(seen::add);
        eventBus.post(new StoreEvents.TablesChangedEvent(Set.of("themes")));
        eventBus.post(new StoreEvents.TablesChangedEvent(Set.of("themes")));

        assertEquals(List.of(1, 3), seen);
    }

    @Test
    void subscribe_again_shouldRestartFromCurrentState() {
        LiveQuery<Integer> live = query(Table.THEMES);
        List<Integer> first = new CopyOnWriteArrayList<>();
        live.subscribe(first::add).close();

        source.set(5);
        List<Integer> second = new CopyOnWriteArrayList<>();
        live.subscribe(second::add);

        assertEquals(List.of(0), first);
        assertEquals(List.of(5), second);
        assertEquals(5, live.get());
    }
}
