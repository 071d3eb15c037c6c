package de.bsommerfeld.sparkle.db;

import de.bsommerfeld.sparkle.core.config.StoreConfig;
import de.bsommerfeld.sparkle.core.domain.Theme;
import de.bsommerfeld.sparkle.core.domain.ValidationResult;
import de.bsommerfeld.sparkle.core.event.ApplicationEventBus;
import de.bsommerfeld.sparkle.core.event.StoreEvents;
import de.bsommerfeld.sparkle.db.migration.MigrationEngine;
import de.bsommerfeld.sparkle.db.migration.MigrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Handle to the SQLite note store. Created once per process through
 * {@link #open} and passed to every component that needs it.
 *
 * <h3>Opening</h3>
 * {@link #open} applies the schema or migrates a legacy database through
 * {@link MigrationEngine} and seeds the default theme. If that fails the
 * handle is never returned.
 *
 * <h3>Connection strategy</h3>
 * Every read opens its own connection and sees the last committed state.
 * The database runs in WAL mode so readers never wait for the writer.
 * Foreign keys are enforced on every connection.
 *
 * <h3>Write units</h3>
 * All writes run on a single writer thread, one unit at a time. A unit owns
 * one connection with auto-commit disabled; component calls made on the
 * writer thread while a unit is active join that connection, so a
 * multi-step operation has exactly one commit point. Any exception inside
 * the unit rolls everything back.
 *
 * <p>
 * After a commit a {@link StoreEvents.TablesChangedEvent} naming the touched
 * tables is posted to the {@link ApplicationEventBus}, which drives
 * {@link LiveQuery} re-emission.
 */
public class NoteDatabase implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(NoteDatabase.class);
    private static final Properties CONNECTION_PROPERTIES = connectionProperties();

    private final String dbUrl;
    private final StoreConfig config;
    private final Clock clock;
    private final ApplicationEventBus eventBus;
    private final ExecutorService writeExecutor;
    private final ThreadLocal<BoundConnection> bound = new ThreadLocal<>();
    private volatile Thread writerThread;

    NoteDatabase(String dbUrl, StoreConfig config, Clock clock, ApplicationEventBus eventBus) {
        this.dbUrl = dbUrl;
        this.config = config;
        this.clock = clock;
        this.eventBus = eventBus;
        this.writeExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "sparkle-db-writer");
            thread.setDaemon(true);
            writerThread = thread;
            return thread;
        });
    }

    /**
     * Opens (creating if needed) the database file, brings its schema to the
     * current version and seeds the default theme.
     *
     * @throws MigrationException if the schema cannot be applied or migrated;
     *                            the store must not be used in that case
     */
    public static NoteDatabase open(Path dbFile, StoreConfig config, Clock clock, ApplicationEventBus eventBus) {
        Path absolute = dbFile.toAbsolutePath();
        try {
            Path parent = absolute.getParent();
            if (parent != null)
                Files.createDirectories(parent);
        } catch (IOException e) {
            throw new MigrationException("Cannot create database directory for " + absolute, e);
        }

        NoteDatabase database = new NoteDatabase("jdbc:sqlite:" + absolute, config, clock, eventBus);
        try {
            database.initialize();
        } catch (RuntimeException e) {
            database.writeExecutor.shutdownNow();
            throw e;
        }
        return database;
    }

    private void initialize() {
        LOG.info("Opening note store at {}", dbUrl);
        ValidationResult defaultName = Theme.validateName(config.getDefaultThemeName());
        if (!defaultName.isValid())
            throw new MigrationException("Configured default theme name '" + config.getDefaultThemeName()
                    + "' is not a valid theme name (" + defaultName + ")");

        try (Connection conn = getConnection()) {
            MigrationEngine engine = new MigrationEngine(config, clock);
            engine.migrate(conn);
            engine.seedDefaultTheme(conn);
        } catch (SQLException e) {
            throw new MigrationException("Failed to open note store at " + dbUrl, e);
        }
        LOG.info("Note store ready.");
    }

    Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl, CONNECTION_PROPERTIES);
    }

    private static Properties connectionProperties() {
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.enforceForeignKeys(true);
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setBusyTimeout(5000);
        return sqlite.toProperties();
    }

    public StoreConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public ApplicationEventBus eventBus() {
        return eventBus;
    }

    // =====================================================================
    // Reads
    // =====================================================================

    /**
     * Runs {@code work} against a fresh connection, or against the active
     * unit's connection when called from inside one.
     */
    public <T> T read(SqlWork<T> work) {
        BoundConnection current = bound.get();
        try {
            if (current != null)
                return work.execute(current.connection);
            try (Connection conn = getConnection()) {
                return work.execute(conn);
            }
        } catch (SQLException e) {
            throw new StoreException(StoreError.storage("Read failed: " + e.getMessage()), e);
        }
    }

    /**
     * Runs {@code work} inside a read transaction so that every query it
     * issues observes the same committed snapshot. Component reads made by
     * {@code work} on this thread share that snapshot. Writes are rejected.
     */
    public <T> T readSnapshot(SqlWork<T> work) {
        if (bound.get() != null)
            return read(work);

        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            bound.set(new BoundConnection(conn, false));
            try {
                return work.execute(conn);
            } finally {
                bound.remove();
                conn.rollback();
            }
        } catch (SQLException e) {
            throw new StoreException(StoreError.storage("Snapshot read failed: " + e.getMessage()), e);
        }
    }

    // =====================================================================
    // Writes
    // =====================================================================

    /**
     * Executes {@code work} as a write touching {@code tables} and blocks
     * until it has committed. Joins the active unit when called from inside
     * one, in which case the commit happens when that unit completes.
     *
     * @throws StoreException if the work is rejected or SQLite fails; the
     *                        write has been rolled back
     */
    public <T> T write(SqlWork<T> work, Table... tables) {
        BoundConnection current = bound.get();
        if (current != null) {
            if (!current.writable)
                throw new IllegalStateException("Write attempted inside a read snapshot");
            Collections.addAll(current.touched, tables);
            try {
                return work.execute(current.connection);
            } catch (SQLException e) {
                throw new StoreException(StoreError.storage(e.getMessage()), e);
            }
        }

        SqlWork<T> tracked = conn -> {
            Collections.addAll(bound.get().touched, tables);
            return work.execute(conn);
        };
        if (Thread.currentThread() == writerThread)
            return runUnit(tracked, () -> false);

        try {
            return submit(tracked).join();
        } catch (CompletionException e) {
            throw propagate(e.getCause());
        }
    }

    /**
     * Queues {@code work} as one write unit on the writer thread.
     *
     * <p>
     * Cancelling the returned future before the unit commits rolls it back;
     * the check happens before the unit starts and again right before the
     * commit.
     */
    public <T> CompletableFuture<T> submit(SqlWork<T> work) {
        return submit(work, (value, failure) -> {
            if (failure != null)
                throw propagate(failure);
            return value;
        });
    }

    /**
     * Queues {@code work} as one write unit and completes the returned future
     * with whatever {@code completion} derives from the unit's outcome.
     * {@code completion} runs on the writer thread after the unit has
     * committed or rolled back, so writes it issues run as units of their
     * own before any later queued unit.
     *
     * <p>
     * The returned future is completed from the future's default async
     * executor, never from the writer thread. Dependent stages may therefore
     * block on further writes without stalling the writer.
     */
    public <T, R> CompletableFuture<R> submit(SqlWork<T> work,
            BiFunction<? super T, Throwable, ? extends R> completion) {
        CompletableFuture<R> future = new CompletableFuture<>();
        try {
            writeExecutor.execute(() -> {
                if (future.isCancelled()) {
                    LOG.debug("[DB] Skipping write unit cancelled before start.");
                    return;
                }
                T value = null;
                Throwable failure = null;
                try {
                    value = runUnit(work, future::isCancelled);
                } catch (Throwable t) {
                    failure = t;
                }
                R outcome;
                try {
                    outcome = completion.apply(value, failure);
                } catch (Throwable t) {
                    future.defaultExecutor().execute(() -> future.completeExceptionally(t));
                    return;
                }
                future.completeAsync(() -> outcome);
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new StoreException(StoreError.storage("Note store is closed"), e));
        }
        return future;
    }

    private <T> T runUnit(SqlWork<T> work, BooleanSupplier cancelled) {
        T result;
        Set<Table> touched;
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            BoundConnection unit = new BoundConnection(conn, true);
            bound.set(unit);
            try {
                result = work.execute(conn);
                if (cancelled.getAsBoolean())
                    throw new CancellationException("Write unit cancelled before commit");
                conn.commit();
                touched = unit.touched;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                if (e instanceof CancellationException) {
                    LOG.warn("[DB] Write unit cancelled before commit, rolled back.");
                } else {
                    LOG.debug("[DB] Write unit rolled back: {}", e.getMessage());
                }
                throw e;
            } finally {
                bound.remove();
            }
        } catch (SQLException e) {
            throw new StoreException(StoreError.storage(e.getMessage()), e);
        }

        publish(touched);
        return result;
    }

    private void publish(Set<Table> touched) {
        if (touched.isEmpty())
            return;
        Set<String> names = touched.stream().map(Table::sqlName).collect(Collectors.toSet());
        eventBus.post(new StoreEvents.TablesChangedEvent(names));
    }

    private static RuntimeException propagate(Throwable failure) {
        if (failure instanceof RuntimeException runtime)
            return runtime;
        if (failure instanceof Error error)
            throw error;
        return new StoreException(StoreError.storage(String.valueOf(failure.getMessage())), failure);
    }

    // =====================================================================
    // Live queries and lifecycle
    // =====================================================================

    /**
     * Wraps {@code query} into a {@link LiveQuery} that re-emits whenever a
     * unit touching one of the given tables commits.
     */
    public <T> LiveQuery<T> liveQuery(Supplier<T> query, Table table, Table... moreTables) {
        return new LiveQuery<>(eventBus, query, EnumSet.of(table, moreTables));
    }

    /**
     * Drains queued write units for up to the configured shutdown timeout,
     * then stops the writer thread.
     */
    @Override
    public void close() {
        LOG.info("Closing note store...");
        writeExecutor.shutdown();
        try {
            if (!writeExecutor.awaitTermination(config.getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                writeExecutor.shutdownNow();
                LOG.warn("Note store forced shutdown (timed out).");
            }
        } catch (InterruptedException e) {
            writeExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class BoundConnection {

        private final Connection connection;
        private final boolean writable;
        private final Set<Table> touched = EnumSet.noneOf(Table.class);

        private BoundConnection(Connection connection, boolean writable) {
            this.connection = connection;
            this.writable = writable;
        }
    }
}
