package de.bsommerfeld.sparkle.db;

import de.bsommerfeld.sparkle.core.config.StoreConfig;
import de.bsommerfeld.sparkle.core.domain.Inspiration;
import de.bsommerfeld.sparkle.core.domain.Theme;
import de.bsommerfeld.sparkle.core.event.ApplicationEventBus;
import de.bsommerfeld.sparkle.core.event.StoreEvents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Isolates the best-effort aggregate refresh. The catalog is a spy whose
 * count update fails; the event bus is mocked to capture the failure event.
 */
@ExtendWith(MockitoExtension.class)
class IntegrityCoordinatorRefreshTest {

    @TempDir
    Path tempDir;

    @Mock
    private ApplicationEventBus eventBus;

    private NoteDatabase database;
    private ThemeCatalog catalog;
    private InspirationStore store;
    private IntegrityCoordinator coordinator;

    @BeforeEach
    void setUp() {
        database = NoteDatabase.open(tempDir.resolve("test.db"), new StoreConfig(), Clock.systemUTC(), eventBus);
        catalog = spy(new ThemeCatalog(database));
        store = new InspirationStore(database);
        coordinator = new IntegrityCoordinator(database, catalog, store);
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void saveInspiration_failingRefresh_shouldStillSucceed() {
        doThrow(new StoreException(StoreError.storage("disk full")))
                .when(catalog).setInspirationCount(eq("Uncategorized"), anyInt());

        StoreResult<Long> result = coordinator.saveInspiration(
                new Inspiration("kept", "Uncategorized", 1L, 1)).join();

        assertTrue(result.isSuccess());
        assertEquals("kept", store.getById(result.getOrThrow()).orElseThrow().content());
        // count stays stale until a repair
        assertEquals(0, catalog.get("Uncategorized").orElseThrow().inspirationCount());

        verify(eventBus).post(argThat(event -> event instanceof StoreEvents.AggregateRefreshFailedEvent failed
                && failed.themeName().equals("Uncategorized")
                && failed.reason().equals("disk full")));
    }

    @Test
    void saveInspiration_failingRefresh_shouldBeRepairedByRefreshAllCounts() {
        doThrow(new StoreException(StoreError.storage("disk full")))
                .doCallRealMethod()
                .when(catalog).setInspirationCount(eq("Uncategorized"), anyInt());

        coordinator.saveInspiration(new Inspiration("kept", "Uncategorized", 1L, 1)).join().getOrThrow();
        coordinator.refreshAllCounts().join().getOrThrow();

        assertEquals(1, catalog.get("Uncategorized").orElseThrow().inspirationCount());
    }

    @Test
    void createTheme_shouldNotTouchAggregates() {
        coordinator.createTheme(Theme.of("Work", 1L)).join().getOrThrow();

        verify(catalog, never()).setInspirationCount(any(), anyInt());
        verify(catalog, never()).setLastUsed(any(), anyLong());
    }
}
