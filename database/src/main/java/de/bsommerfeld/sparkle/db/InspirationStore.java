package de.bsommerfeld.sparkle.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sparkle.core.domain.Inspiration;
import de.bsommerfeld.sparkle.core.domain.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns the {@code inspirations} table.
 *
 * <p>
 * The store does not check that {@code themeName} refers to an existing
 * theme; the foreign key rejects such writes, and
 * {@link IntegrityCoordinator} reports them as {@code NOT_FOUND} before they
 * reach SQLite. Cached theme aggregates are likewise not touched here.
 */
@Singleton
public class InspirationStore {

    private static final Logger LOG = LoggerFactory.getLogger(InspirationStore.class);

    private final NoteDatabase database;

    @Inject
    public InspirationStore(NoteDatabase database) {
        this.database = database;
    }

    // =====================================================================
    // Mutations
    // =====================================================================

    /**
     * Persists a new inspiration. The {@code id} of the argument is ignored.
     *
     * @return the id assigned by the store
     * @throws StoreException {@code INVALID_CONTENT}
     */
    public long insert(Inspiration inspiration) {
        requireValidContent(inspiration);
        return database.write(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-inspiration"))) {
                ps.setString(1, inspiration.content());
                ps.setString(2, inspiration.themeName());
                ps.setLong(3, inspiration.createdAt());
                ps.setInt(4, inspiration.wordCount());
                ps.executeUpdate();
            }
            long id;
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("last-insert-id"));
                    ResultSet rs = ps.executeQuery()) {
                rs.next();
                id = rs.getLong(1);
            }
            LOG.debug("[DB] Inserted inspiration {} under '{}'.", id, inspiration.themeName());
            return id;
        }, Table.INSPIRATIONS);
    }

    /**
     * Replaces every column of the row with the same id.
     *
     * @throws StoreException {@code INVALID_CONTENT} or {@code NOT_FOUND}
     */
    public void update(Inspiration inspiration) {
        requireValidContent(inspiration);
        database.write(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-inspiration"))) {
                ps.setString(1, inspiration.content());
                ps.setString(2, inspiration.themeName());
                ps.setLong(3, inspiration.createdAt());
                ps.setInt(4, inspiration.wordCount());
                ps.setLong(5, inspiration.id());
                if (ps.executeUpdate() == 0)
                    throw new StoreException(StoreError.inspirationNotFound(inspiration.id()));
            }
            return null;
        }, Table.INSPIRATIONS);
    }

    /** @return {@code 1} if the row existed, {@code 0} otherwise */
    public int deleteById(long id) {
        return database.write(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-inspiration"))) {
                ps.setLong(1, id);
                return ps.executeUpdate();
            }
        }, Table.INSPIRATIONS);
    }

    /**
     * Deletes all rows whose id is in {@code ids}, in one unit.
     *
     * @return number of rows actually deleted
     */
    public int deleteByIds(Collection<Long> ids) {
        if (ids.isEmpty())
            return 0;
        return database.write(conn -> {
            int deleted = 0;
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-inspiration"))) {
                for (long id : ids) {
                    ps.setLong(1, id);
                    deleted += ps.executeUpdate();
                }
            }
            LOG.debug("[DB] Batch deleted {} of {} inspirations.", deleted, ids.size());
            return deleted;
        }, Table.INSPIRATIONS);
    }

    /**
     * Deletes every inspiration of a theme. This is the discard path, used
     * when a theme and its notes are removed together.
     */
    public int deleteByTheme(String themeName) {
        return database.write(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-inspirations-by-theme"))) {
                ps.setString(1, themeName);
                return ps.executeUpdate();
            }
        }, Table.INSPIRATIONS);
    }

    /**
     * Re-points every inspiration of {@code oldName} at {@code newName}. Only
     * used as the cascade step of a theme rename.
     *
     * @return number of rows updated
     */
    public int updateThemeNameForAll(String oldName, String newName) {
        return database.write(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-inspiration-theme-names"))) {
                ps.setString(1, newName);
                ps.setString(2, oldName);
                return ps.executeUpdate();
            }
        }, Table.INSPIRATIONS);
    }

    // =====================================================================
    // Queries
    // =====================================================================

    public Optional<Inspiration> getById(long id) {
        return database.read(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-inspiration"))) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapInspiration(rs)) : Optional.empty();
                }
            }
        });
    }

    /** All inspirations, newest first. */
    public List<Inspiration> getAll() {
        return query("select-all-inspirations", null);
    }

    /** Inspirations of one theme, newest first. */
    public List<Inspiration> getByTheme(String themeName) {
        return query("select-inspirations-by-theme", themeName);
    }

    /** Inspirations whose theme name has no matching row in {@code themes}. */
    public List<Inspiration> getOrphans() {
        return query("select-orphaned-inspirations", null);
    }

    /**
     * Case-insensitive substring search over content and theme name, newest
     * first. The keyword is matched as given, surrounding whitespace
     * included; an empty keyword matches everything.
     *
     * <p>
     * Matching is done in Java because SQLite's {@code LIKE} and
     * {@code LOWER} only fold ASCII.
     */
    public List<Inspiration> search(String keyword) {
        List<Inspiration> all = getAll();
        if (keyword == null || keyword.isEmpty())
            return all;
        String needle = keyword.toLowerCase(Locale.ROOT);
        return all.stream()
                .filter(i -> i.content().toLowerCase(Locale.ROOT).contains(needle)
                        || i.themeName().toLowerCase(Locale.ROOT).contains(needle))
                .collect(Collectors.toList());
    }

    public int count() {
        return countQuery("count-inspirations", null);
    }

    public int countByTheme(String themeName) {
        return countQuery("count-inspirations-by-theme", themeName);
    }

    /** Distinct theme names in use by at least one inspiration, sorted. */
    public List<String> distinctThemeNames() {
        return database.read(conn -> {
            List<String> names = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-distinct-theme-names"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    names.add(rs.getString(1));
            }
            return names;
        });
    }

    // -- Live queries --

    public LiveQuery<List<Inspiration>> observeAll() {
        return database.liveQuery(this::getAll, Table.INSPIRATIONS);
    }

    public LiveQuery<List<Inspiration>> observeByTheme(String themeName) {
        return database.liveQuery(() -> getByTheme(themeName), Table.INSPIRATIONS);
    }

    public LiveQuery<List<Inspiration>> observeSearch(String keyword) {
        return database.liveQuery(() -> search(keyword), Table.INSPIRATIONS);
    }

    public LiveQuery<Integer> observeCount() {
        return database.liveQuery(this::count, Table.INSPIRATIONS);
    }

    public LiveQuery<Integer> observeCountByTheme(String themeName) {
        return database.liveQuery(() -> countByTheme(themeName), Table.INSPIRATIONS);
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private List<Inspiration> query(String sqlName, String themeName) {
        return database.read(conn -> {
            List<Inspiration> result = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
                if (themeName != null)
                    ps.setString(1, themeName);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        result.add(mapInspiration(rs));
                }
            }
            return result;
        });
    }

    private int countQuery(String sqlName, String themeName) {
        return database.read(conn -> count(conn, sqlName, themeName));
    }

    private static int count(Connection conn, String sqlName, String themeName) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
            if (themeName != null)
                ps.setString(1, themeName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private static void requireValidContent(Inspiration inspiration) {
        ValidationResult result = inspiration.validateContent();
        if (!result.isValid())
            throw new StoreException(StoreError.invalidContent(result));
    }

    private static Inspiration mapInspiration(ResultSet rs) throws SQLException {
        return new Inspiration(
                rs.getLong("id"), rs.getString("content"),
                rs.getString("theme_name"), rs.getLong("created_at"),
                rs.getInt("word_count"));
    }
}
