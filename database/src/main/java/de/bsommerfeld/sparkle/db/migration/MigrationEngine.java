package de.bsommerfeld.sparkle.db.migration;

import de.bsommerfeld.sparkle.core.config.StoreConfig;
import de.bsommerfeld.sparkle.core.domain.Theme;
import de.bsommerfeld.sparkle.db.SqlLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Brings a database file to the current schema version. The version lives in
 * SQLite's {@code PRAGMA user_version}:
 * <ul>
 * <li>{@code 0}: empty file, or a legacy file that never recorded a
 * version</li>
 * <li>{@code 1}: legacy flat schema, a single {@code inspirations} table with
 * the theme stored as a free-text {@code theme_name}</li>
 * <li>{@code 2}: normalized schema with a {@code themes} table and a foreign
 * key from {@code inspirations.theme_name}</li>
 * </ul>
 *
 * <h3>Legacy migration (1 → 2)</h3>
 * Rows whose content equals {@link Theme#THEME_MARKER} are placeholders from
 * the old theme-tracking scheme and are dropped. Each distinct remaining
 * label becomes a theme with default display metadata and its row count as
 * {@code inspirationCount}. Rows whose label is blank or fails
 * {@link Theme#validateName(String)} are filed under the default theme. The inspirations table is rebuilt with the foreign key and
 * swapped in by drop-and-rename, then its indexes are recreated.
 *
 * <p>
 * Everything, including the version bump, runs in one transaction. A crash
 * or error leaves the old schema fully intact.
 */
public class MigrationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationEngine.class);

    public static final int LEGACY_VERSION = 1;
    public static final int CURRENT_VERSION = 2;

    private final StoreConfig config;
    private final Clock clock;

    public MigrationEngine(StoreConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Inspects the schema on {@code conn} and applies whatever step is needed.
     * Safe to call on every startup; a current database is left untouched.
     *
     * @throws MigrationException if the schema cannot be brought up to date
     */
    public void migrate(Connection conn) {
        try {
            int version = readUserVersion(conn);
            if (version >= CURRENT_VERSION) {
                LOG.debug("[Migration] Schema at version {}, nothing to do.", version);
                return;
            }

            boolean hasInspirations = tableExists(conn, "inspirations");
            boolean hasThemes = tableExists(conn, "themes");

            runInTransaction(conn, () -> {
                if (!hasInspirations) {
                    applySchema(conn);
                } else if (!hasThemes) {
                    migrateLegacy(conn);
                } else {
                    LOG.info("[Migration] Normalized tables present without version marker, stamping version {}.",
                            CURRENT_VERSION);
                }
                writeUserVersion(conn, CURRENT_VERSION);
            });
        } catch (SQLException e) {
            throw new MigrationException("Schema migration to version " + CURRENT_VERSION + " failed", e);
        }
    }

    /**
     * Inserts the configured default theme unless a theme of that name exists.
     */
    public void seedDefaultTheme(Connection conn) throws SQLException {
        Theme theme = config.defaultTheme(clock.millis());
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("seed-default-theme"))) {
            ps.setString(1, theme.name());
            ps.setString(2, theme.icon());
            ps.setLong(3, theme.color());
            ps.setString(4, theme.description());
            ps.setLong(5, theme.createdAt());
            ps.setLong(6, theme.lastUsed());
            if (ps.executeUpdate() > 0)
                LOG.info("[Migration] Seeded default theme '{}'.", theme.name());
        }
    }

    private void applySchema(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.loadStatements("schema"))
                stmt.execute(sql);
        }
        LOG.info("[Migration] Fresh database, schema version {} applied.", CURRENT_VERSION);
    }

    private void migrateLegacy(Connection conn) throws SQLException {
        long now = clock.millis();
        String fallback = config.getDefaultThemeName();
        LOG.info("[Migration] Legacy schema detected, migrating to version {}...", CURRENT_VERSION);

        execute(conn, SqlLoader.load("migration/create-themes-table"));

        Map<String, Integer> labels = collectLegacyLabels(conn, fallback);
        insertMigratedThemes(conn, labels, now);

        execute(conn, SqlLoader.load("migration/create-inspirations-v2"));
        int copied;
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("migration/copy-legacy-inspirations"))) {
            ps.setString(1, fallback);
            ps.setString(2, Theme.THEME_MARKER);
            copied = ps.executeUpdate();
        }

        execute(conn, SqlLoader.load("migration/drop-legacy-inspirations"));
        execute(conn, SqlLoader.load("migration/rename-inspirations-v2"));
        for (String sql : SqlLoader.loadStatements("migration/create-inspirations-indexes"))
            execute(conn, sql);

        LOG.info("[Migration] Migrated {} inspirations into {} themes.", copied, labels.size());
    }

    /**
     * Counts the non-marker legacy rows per label. Blank labels are merged
     * into {@code fallback}; other labels that are not valid theme names are
     * rewritten to {@code fallback} in the legacy table before the copy.
     */
    private Map<String, Integer> collectLegacyLabels(Connection conn, String fallback) throws SQLException {
        Map<String, Integer> labels = new LinkedHashMap<>();
        List<String> rejected = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("migration/count-legacy-labels"))) {
            ps.setString(1, Theme.THEME_MARKER);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String label = rs.getString("theme_name");
                    String name = label;
                    if (label == null || label.isBlank()) {
                        name = fallback;
                    } else if (!Theme.validateName(label).isValid()) {
                        rejected.add(label);
                        name = fallback;
                    }
                    labels.merge(name, rs.getInt("label_count"), Integer::sum);
                }
            }
        }

        if (!rejected.isEmpty()) {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("migration/remap-legacy-label"))) {
                for (String label : rejected) {
                    LOG.warn("[Migration] Legacy theme name '{}' is not valid ({}), filing its inspirations under '{}'.",
                            label, Theme.validateName(label), fallback);
                    ps.setString(1, fallback);
                    ps.setString(2, label);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
        }
        return labels;
    }

    private void insertMigratedThemes(Connection conn, Map<String, Integer> labels, long now) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-theme"))) {
            for (Map.Entry<String, Integer> label : labels.entrySet()) {
                String name = label.getKey();
                boolean isDefault = name.equals(config.getDefaultThemeName());
                ps.setString(1, name);
                ps.setString(2, isDefault ? config.getDefaultThemeIcon() : Theme.DEFAULT_ICON);
                ps.setLong(3, isDefault ? config.getDefaultThemeColor() : Theme.DEFAULT_COLOR);
                ps.setString(4, "");
                ps.setLong(5, now);
                ps.setLong(6, now);
                ps.setInt(7, label.getValue());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private static int readUserVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("PRAGMA user_version")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static void writeUserVersion(Connection conn, int version) throws SQLException {
        execute(conn, "PRAGMA user_version = " + version);
    }

    private static boolean tableExists(Connection conn, String table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("migration/table-exists"))) {
            ps.setString(1, table);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private static void execute(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    private static void runInTransaction(Connection conn, SqlStep step) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            step.run();
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    @FunctionalInterface
    private interface SqlStep {
        void run() throws SQLException;
    }
}
