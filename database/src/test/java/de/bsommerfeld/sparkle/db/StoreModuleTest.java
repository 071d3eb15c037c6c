package de.bsommerfeld.sparkle.db;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.sparkle.core.config.StoreConfig;
import de.bsommerfeld.sparkle.core.domain.Inspiration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StoreModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void injector_shouldWireSingletonComponents() {
        Injector injector = Guice.createInjector(new StoreModule(tempDir));

        try (NoteDatabase database = injector.getInstance(NoteDatabase.class)) {
            assertSame(database, injector.getInstance(NoteDatabase.class));
            assertSame(injector.getInstance(ThemeCatalog.class), injector.getInstance(ThemeCatalog.class));

            IntegrityCoordinator coordinator = injector.getInstance(IntegrityCoordinator.class);
            long id = coordinator.saveInspiration(new Inspiration("wired", "Uncategorized", 1L, 1))
                    .join().getOrThrow();

            assertTrue(injector.getInstance(InspirationStore.class).getById(id).isPresent());
            assertTrue(injector.getInstance(DataValidator.class).check().isValid());
        }
    }

    @Test
    void injector_shouldCreateConfigAndDatabaseInDataDir() {
        Injector injector = Guice.createInjector(new StoreModule(tempDir));

        try (NoteDatabase ignored = injector.getInstance(NoteDatabase.class)) {
            assertTrue(Files.exists(tempDir.resolve("config.toml")));
            assertTrue(Files.exists(tempDir.resolve(injector.getInstance(StoreConfig.class).getDatabaseFile())));
        }
    }
}
