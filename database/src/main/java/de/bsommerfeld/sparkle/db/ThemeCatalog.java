package de.bsommerfeld.sparkle.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.sparkle.core.config.StoreConfig;
import de.bsommerfeld.sparkle.core.domain.Theme;
import de.bsommerfeld.sparkle.core.domain.ThemeOrder;
import de.bsommerfeld.sparkle.core.domain.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owns the {@code themes} table: the set of valid theme names plus their
 * display metadata and cached aggregates.
 *
 * <p>
 * Every mutation here touches the {@code themes} table only. Operations that
 * must also move inspirations (rename, delete with reassignment) are composed
 * by {@link IntegrityCoordinator}; calling {@link #delete} directly while
 * inspirations still reference the theme lets the physical
 * {@code ON DELETE CASCADE} remove them.
 *
 * <p>
 * Rejections are thrown as {@link StoreException}, which rolls back the
 * surrounding write unit.
 */
@Singleton
public class ThemeCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(ThemeCatalog.class);

    private final NoteDatabase database;
    private final StoreConfig config;

    @Inject
    public ThemeCatalog(NoteDatabase database) {
        this.database = database;
        this.config = database.config();
    }

    // =====================================================================
    // Mutations
    // =====================================================================

    /**
     * Inserts {@code theme} with the aggregates it carries.
     *
     * @throws StoreException {@code INVALID_NAME} or {@code DUPLICATE_KEY}
     */
    public Theme create(Theme theme) {
        requireValidName(theme.name());
        return database.write(conn -> {
            if (exists(conn, theme.name()))
                throw new StoreException(StoreError.duplicateKey(theme.name()));
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-theme"))) {
                ps.setString(1, theme.name());
                ps.setString(2, theme.icon());
                ps.setLong(3, theme.color());
                ps.setString(4, theme.description());
                ps.setLong(5, theme.createdAt());
                ps.setLong(6, theme.lastUsed());
                ps.setInt(7, theme.inspirationCount());
                ps.executeUpdate();
            }
            LOG.debug("[DB] Created theme '{}'.", theme.name());
            return theme;
        }, Table.THEMES);
    }

    /**
     * Changes the primary key of a theme. Renaming a theme to its own name is
     * a no-op. The physical {@code ON UPDATE CASCADE} follows the rename in
     * {@code inspirations}; {@link IntegrityCoordinator#renameTheme} still
     * runs the explicit cascade in the same unit.
     *
     * @throws StoreException {@code INVALID_NAME}, {@code PROTECTED_THEME} for
     *                        the default theme, {@code NOT_FOUND} if
     *                        {@code oldName} is absent, {@code DUPLICATE_KEY}
     *                        if {@code newName} is taken
     */
    public void rename(String oldName, String newName) {
        requireValidName(newName);
        if (isDefault(oldName))
            throw new StoreException(StoreError.protectedTheme(oldName));

        database.write(conn -> {
            if (!exists(conn, oldName))
                throw new StoreException(StoreError.themeNotFound(oldName));
            if (oldName.equals(newName))
                return null;
            if (exists(conn, newName))
                throw new StoreException(StoreError.duplicateKey(newName));
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("rename-theme"))) {
                ps.setString(1, newName);
                ps.setString(2, oldName);
                ps.executeUpdate();
            }
            LOG.debug("[DB] Renamed theme '{}' to '{}'.", oldName, newName);
            return null;
        }, Table.THEMES, Table.INSPIRATIONS);
    }

    /**
     * Replaces icon, color and description. Name and aggregates are left as
     * stored.
     *
     * @return the theme as stored after the update
     * @throws StoreException {@code NOT_FOUND}
     */
    public Theme update(Theme theme) {
        return database.write(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-theme-metadata"))) {
                ps.setString(1, theme.icon());
                ps.setLong(2, theme.color());
                ps.setString(3, theme.description());
                ps.setString(4, theme.name());
                if (ps.executeUpdate() == 0)
                    throw new StoreException(StoreError.themeNotFound(theme.name()));
            }
            return find(conn, theme.name()).orElseThrow();
        }, Table.THEMES);
    }

    /**
     * Removes the theme row. Low-level primitive: callers are expected to have
     * moved or deleted its inspirations first.
     *
     * @throws StoreException {@code PROTECTED_THEME} or {@code NOT_FOUND}
     */
    public void delete(String name) {
        if (isDefault(name))
            throw new StoreException(StoreError.protectedTheme(name));
        database.write(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-theme"))) {
                ps.setString(1, name);
                if (ps.executeUpdate() == 0)
                    throw new StoreException(StoreError.themeNotFound(name));
            }
            LOG.debug("[DB] Deleted theme '{}'.", name);
            return null;
        }, Table.THEMES, Table.INSPIRATIONS);
    }

    /** Aggregate primitive. {@code NOT_FOUND} if the theme is absent. */
    public void setLastUsed(String name, long timestamp) {
        updateAggregate("update-theme-last-used", name, timestamp);
    }

    /** Aggregate primitive. {@code NOT_FOUND} if the theme is absent. */
    public void setInspirationCount(String name, int count) {
        if (count < 0)
            throw new IllegalArgumentException("Inspiration count must not be negative: " + count);
        updateAggregate("update-theme-count", name, count);
    }

    private void updateAggregate(String sqlName, String themeName, long value) {
        database.write(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
                ps.setLong(1, value);
                ps.setString(2, themeName);
                if (ps.executeUpdate() == 0)
                    throw new StoreException(StoreError.themeNotFound(themeName));
            }
            return null;
        }, Table.THEMES);
    }

    // =====================================================================
    // Queries
    // =====================================================================

    public Optional<Theme> get(String name) {
        return database.read(conn -> find(conn, name));
    }

    public boolean exists(String name) {
        return database.read(conn -> exists(conn, name));
    }

    public int count() {
        return database.read(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("count-themes"));
                    ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
    }

    public List<Theme> list(ThemeOrder order) {
        String sql = SqlLoader.load(listQuery(order));
        return database.read(conn -> {
            List<Theme> themes = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(sql);
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    themes.add(mapTheme(rs));
            }
            return themes;
        });
    }

    public LiveQuery<List<Theme>> observe(ThemeOrder order) {
        return database.liveQuery(() -> list(order), Table.THEMES);
    }

    public LiveQuery<Optional<Theme>> observe(String name) {
        return database.liveQuery(() -> get(name), Table.THEMES);
    }

    public boolean isDefault(String name) {
        return config.getDefaultThemeName().equals(name);
    }

    private static String listQuery(ThemeOrder order) {
        switch (order) {
            case LAST_USED_DESC:
                return "select-themes-by-last-used";
            case INSPIRATION_COUNT_DESC:
                return "select-themes-by-count";
            case NAME_ASC:
            default:
                return "select-themes-by-name";
        }
    }

    private static void requireValidName(String name) {
        ValidationResult result = Theme.validateName(name);
        if (!result.isValid())
            throw new StoreException(StoreError.invalidName(name, result));
    }

    private static boolean exists(Connection conn, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("exists-theme"))) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private static Optional<Theme> find(Connection conn, String name) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-theme"))) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTheme(rs)) : Optional.empty();
            }
        }
    }

    private static Theme mapTheme(ResultSet rs) throws SQLException {
        return new Theme(
                rs.getString("name"), rs.getString("icon"),
                rs.getLong("color"), rs.getString("description"),
                rs.getLong("createdAt"), rs.getLong("lastUsed"),
                rs.getInt("inspirationCount"));
    }
}
