package de.bsommerfeld.sparkle.db;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.sparkle.core.config.ConfigLoader;
import de.bsommerfeld.sparkle.core.config.StoreConfig;
import de.bsommerfeld.sparkle.core.event.ApplicationEventBus;
import de.bsommerfeld.sparkle.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice wiring for the note store. Configuration is read from
 * {@code config.toml} in the data directory; the database file is resolved
 * against the same directory.
 *
 * <p>
 * The provided {@link NoteDatabase} is opened eagerly on first injection and
 * must be closed by the application on shutdown.
 */
public class StoreModule extends AbstractModule {

    public static final String APP_NAME = "sparkle-note";

    private static final Logger LOG = LoggerFactory.getLogger(StoreModule.class);

    private final Path dataDir;

    public StoreModule() {
        this(StorageUtils.getAppDataDir(APP_NAME));
    }

    public StoreModule(Path dataDir) {
        this.dataDir = dataDir;
    }

    @Override
    protected void configure() {
        Path configPath = dataDir.resolve("config.toml");
        try {
            bind(StoreConfig.class).toInstance(ConfigLoader.load(configPath));
        } catch (IOException e) {
            // Config is vital; fail fast
            throw new IllegalStateException("Failed to load store configuration from " + configPath, e);
        }
        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(ApplicationEventBus.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    NoteDatabase provideNoteDatabase(StoreConfig config, Clock clock, ApplicationEventBus eventBus) {
        Path dbFile = dataDir.resolve(config.getDatabaseFile());
        LOG.info("Note store data directory: {}", dataDir.toAbsolutePath());
        return NoteDatabase.open(dbFile, config, clock, eventBus);
    }
}
