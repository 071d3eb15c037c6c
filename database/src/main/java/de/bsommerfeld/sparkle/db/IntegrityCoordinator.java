package de.bsommerfeld.sparkle.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sparkle.core.config.StoreConfig;
import de.bsommerfeld.sparkle.core.domain.Inspiration;
import de.bsommerfeld.sparkle.core.domain.Theme;
import de.bsommerfeld.sparkle.core.domain.ThemeOrder;
import de.bsommerfeld.sparkle.core.domain.ValidationResult;
import de.bsommerfeld.sparkle.core.event.ApplicationEventBus;
import de.bsommerfeld.sparkle.core.event.StoreEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Single entry point for every mutation that spans themes and inspirations.
 *
 * <h3>Units</h3>
 * Each operation is one write unit on the {@link NoteDatabase} writer
 * thread. The catalog and store calls it makes join that unit, so the
 * operation either commits completely or not at all.
 *
 * <h3>Aggregates</h3>
 * After a successful commit the affected themes' {@code inspirationCount}
 * and {@code lastUsed} are refreshed as separate, best-effort units. A
 * refresh failure is logged, posted as
 * {@link StoreEvents.AggregateRefreshFailedEvent} and otherwise ignored: the
 * mutation that triggered it stays committed and its result stays a success.
 * {@link #refreshAllCounts()} repairs stale counts.
 *
 * <h3>Results</h3>
 * Every operation completes its future with a {@link StoreResult}; expected
 * failures never complete it exceptionally. Cancelling the future before
 * the unit commits rolls the unit back. Futures complete off the writer
 * thread, so a dependent stage may call and join another operation.
 */
@Singleton
public class IntegrityCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(IntegrityCoordinator.class);

    private final NoteDatabase database;
    private final ThemeCatalog catalog;
    private final InspirationStore inspirations;
    private final StoreConfig config;
    private final Clock clock;
    private final ApplicationEventBus eventBus;

    @Inject
    public IntegrityCoordinator(NoteDatabase database, ThemeCatalog catalog, InspirationStore inspirations) {
        this.database = database;
        this.catalog = catalog;
        this.inspirations = inspirations;
        this.config = database.config();
        this.clock = database.clock();
        this.eventBus = database.eventBus();
    }

    // =====================================================================
    // Themes
    // =====================================================================

    /**
     * Creates a theme. The stored theme always starts with an
     * {@code inspirationCount} of zero.
     */
    public CompletableFuture<StoreResult<Theme>> createTheme(Theme theme) {
        ValidationResult validation = theme.validateName();
        if (!validation.isValid())
            return completed(StoreError.invalidName(theme.name(), validation));
        return run("createTheme", conn -> catalog.create(theme.withInspirationCount(0)), null);
    }

    /**
     * Renames a theme and moves all of its inspirations along in the same
     * unit.
     *
     * @return the renamed theme
     */
    public CompletableFuture<StoreResult<Theme>> renameTheme(String oldName, String newName) {
        return run("renameTheme", conn -> {
            catalog.rename(oldName, newName);
            int moved = inspirations.updateThemeNameForAll(oldName, newName);
            LOG.debug("[DB] Rename '{}' -> '{}' rewrote {} inspirations explicitly.", oldName, newName, moved);
            return catalog.get(newName).orElseThrow();
        }, null);
    }

    /** Updates icon, color and description of an existing theme. */
    public CompletableFuture<StoreResult<Theme>> updateTheme(Theme theme) {
        return run("updateTheme", conn -> catalog.update(theme), null);
    }

    /**
     * Deletes a theme, moving its inspirations to the default theme.
     *
     * @see #deleteTheme(String, String)
     */
    public CompletableFuture<StoreResult<Integer>> deleteTheme(String name) {
        return deleteTheme(name, config.getDefaultThemeName());
    }

    /**
     * Deletes a theme after reassigning every one of its inspirations to
     * {@code moveTo}. {@code moveTo} must already exist.
     *
     * @return number of reassigned inspirations
     */
    public CompletableFuture<StoreResult<Integer>> deleteTheme(String name, String moveTo) {
        if (catalog.isDefault(name))
            return completed(StoreError.protectedTheme(name));
        if (name.equals(moveTo))
            return completed(StoreError.invalidName(moveTo, ValidationResult.INVALID));

        return run("deleteTheme", conn -> {
            requireTheme(name);
            requireTheme(moveTo);
            int moved = inspirations.updateThemeNameForAll(name, moveTo);
            catalog.delete(name);
            catalog.setInspirationCount(moveTo, inspirations.countByTheme(moveTo));
            LOG.debug("[DB] Deleted theme '{}', reassigned {} inspirations to '{}'.", name, moved, moveTo);
            return moved;
        }, moved -> {
            if (moved > 0)
                recordUsage(moveTo);
        });
    }

    /**
     * Deletes a theme together with all of its inspirations.
     *
     * @return number of deleted inspirations
     */
    public CompletableFuture<StoreResult<Integer>> deleteThemeWithInspirations(String name) {
        if (catalog.isDefault(name))
            return completed(StoreError.protectedTheme(name));

        return run("deleteThemeWithInspirations", conn -> {
            requireTheme(name);
            int deleted = inspirations.deleteByTheme(name);
            catalog.delete(name);
            LOG.debug("[DB] Deleted theme '{}' with {} inspirations.", name, deleted);
            return deleted;
        }, null);
    }

    // =====================================================================
    // Inspirations
    // =====================================================================

    /**
     * Stores a new inspiration under an existing theme and records the
     * theme's usage.
     *
     * @return the assigned id
     */
    public CompletableFuture<StoreResult<Long>> saveInspiration(Inspiration inspiration) {
        ValidationResult validation = inspiration.validateContent();
        if (!validation.isValid())
            return completed(StoreError.invalidContent(validation));

        return run("saveInspiration", conn -> {
            requireTheme(inspiration.themeName());
            return inspirations.insert(inspiration);
        }, id -> recordUsage(inspiration.themeName()));
    }

    /**
     * Replaces an inspiration. When its theme changes, the counts of both
     * the previous and the new theme are refreshed.
     */
    public CompletableFuture<StoreResult<Inspiration>> updateInspiration(Inspiration inspiration) {
        ValidationResult validation = inspiration.validateContent();
        if (!validation.isValid())
            return completed(StoreError.invalidContent(validation));

        AtomicReference<String> previousTheme = new AtomicReference<>();
        return run("updateInspiration", conn -> {
            Inspiration previous = inspirations.getById(inspiration.id())
                    .orElseThrow(() -> new StoreException(StoreError.inspirationNotFound(inspiration.id())));
            requireTheme(inspiration.themeName());
            inspirations.update(inspiration);
            previousTheme.set(previous.themeName());
            return inspiration;
        }, updated -> {
            recordUsage(updated.themeName());
            if (!previousTheme.get().equals(updated.themeName()))
                refreshCount(previousTheme.get());
        });
    }

    /** @return the deleted inspiration */
    public CompletableFuture<StoreResult<Inspiration>> deleteInspiration(long id) {
        return run("deleteInspiration", conn -> {
            Inspiration existing = inspirations.getById(id)
                    .orElseThrow(() -> new StoreException(StoreError.inspirationNotFound(id)));
            inspirations.deleteById(id);
            return existing;
        }, deleted -> recordUsage(deleted.themeName()));
    }

    /**
     * Deletes every inspiration whose id is in {@code ids}. Unknown ids are
     * skipped.
     *
     * @return number of deleted inspirations
     */
    public CompletableFuture<StoreResult<Integer>> deleteInspirations(Collection<Long> ids) {
        Set<String> touched = new LinkedHashSet<>();
        return run("deleteInspirations", conn -> {
            for (long id : ids)
                inspirations.getById(id).ifPresent(i -> touched.add(i.themeName()));
            return inspirations.deleteByIds(ids);
        }, deleted -> touched.forEach(this::recordUsage));
    }

    // =====================================================================
    // Aggregates and repair
    // =====================================================================

    /**
     * Sets the theme's {@code lastUsed} to now and its
     * {@code inspirationCount} to the current number of referencing
     * inspirations. Never throws.
     */
    public void recordUsage(String themeName) {
        refreshAggregates(themeName, true);
    }

    private void refreshCount(String themeName) {
        refreshAggregates(themeName, false);
    }

    private void refreshAggregates(String themeName, boolean touchLastUsed) {
        try {
            database.write(conn -> {
                catalog.setInspirationCount(themeName, inspirations.countByTheme(themeName));
                if (touchLastUsed)
                    catalog.setLastUsed(themeName, clock.millis());
                return null;
            }, Table.THEMES);
        } catch (RuntimeException e) {
            LOG.warn("[DB] {} for theme '{}': {}", ErrorKind.AGGREGATE_REFRESH_FAILURE, themeName, e.getMessage());
            eventBus.post(new StoreEvents.AggregateRefreshFailedEvent(themeName, String.valueOf(e.getMessage())));
        }
    }

    /**
     * Recomputes {@code inspirationCount} of every theme in one unit.
     *
     * @return number of themes whose stored count was wrong
     */
    public CompletableFuture<StoreResult<Integer>> refreshAllCounts() {
        return run("refreshAllCounts", conn -> {
            int corrected = 0;
            for (Theme theme : catalog.list(ThemeOrder.NAME_ASC)) {
                int actual = inspirations.countByTheme(theme.name());
                if (actual != theme.inspirationCount()) {
                    catalog.setInspirationCount(theme.name(), actual);
                    corrected++;
                }
            }
            if (corrected > 0)
                LOG.info("[DB] Corrected inspiration count of {} themes.", corrected);
            return corrected;
        }, null);
    }

    /**
     * Moves every inspiration whose theme does not exist to the default
     * theme.
     *
     * @return number of repaired inspirations
     */
    public CompletableFuture<StoreResult<Integer>> reassignOrphans() {
        String fallback = config.getDefaultThemeName();
        return run("reassignOrphans", conn -> {
            Set<String> missingThemes = new LinkedHashSet<>();
            for (Inspiration orphan : inspirations.getOrphans())
                missingThemes.add(orphan.themeName());
            int repaired = 0;
            for (String missing : missingThemes)
                repaired += inspirations.updateThemeNameForAll(missing, fallback);
            catalog.setInspirationCount(fallback, inspirations.countByTheme(fallback));
            if (repaired > 0)
                LOG.info("[DB] Reassigned {} orphaned inspirations to '{}'.", repaired, fallback);
            return repaired;
        }, null);
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private void requireTheme(String name) {
        if (!catalog.exists(name))
            throw new StoreException(StoreError.themeNotFound(name));
    }

    private <T> CompletableFuture<StoreResult<T>> run(String operation, SqlWork<T> work, Consumer<T> afterCommit) {
        return database.submit(work, (value, failure) -> {
            if (failure != null)
                return toResult(operation, failure);
            if (afterCommit != null)
                afterCommit.accept(value);
            return StoreResult.success(value);
        });
    }

    private static <T> StoreResult<T> toResult(String operation, Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        if (cause instanceof StoreException storeException) {
            StoreError error = storeException.getError();
            if (error.kind() == ErrorKind.STORAGE_FAILURE)
                LOG.error("[DB] {} failed: {}", operation, error.message(), cause);
            else
                LOG.debug("[DB] {} rejected: {}", operation, error.message());
            return StoreResult.failure(error);
        }
        if (cause instanceof CancellationException) {
            return StoreResult.failure(StoreError.storage(operation + " cancelled"));
        }
        LOG.error("[DB] {} failed unexpectedly", operation, cause);
        return StoreResult.failure(StoreError.storage(operation + " failed: " + cause.getMessage()));
    }

    private static <T> CompletableFuture<StoreResult<T>> completed(StoreError error) {
        LOG.debug("[DB] Rejected before queueing: {}", error.message());
        return CompletableFuture.completedFuture(StoreResult.failure(error));
    }
}
