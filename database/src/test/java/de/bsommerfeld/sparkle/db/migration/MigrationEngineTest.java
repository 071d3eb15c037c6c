package de.bsommerfeld.sparkle.db.migration;

import de.bsommerfeld.sparkle.core.config.StoreConfig;
import de.bsommerfeld.sparkle.core.domain.Theme;
import de.bsommerfeld.sparkle.core.event.ApplicationEventBus;
import de.bsommerfeld.sparkle.db.InspirationStore;
import de.bsommerfeld.sparkle.db.NoteDatabase;
import de.bsommerfeld.sparkle.db.ThemeCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the engine against hand-built legacy files. The connection is opened
 * without the store's connection settings, as an older app version would
 * have left it.
 */
class MigrationEngineTest {

    private static final String LEGACY_SCHEMA = "CREATE TABLE inspirations ("
            + "id INTEGER PRIMARY KEY AUTOINCREMENT NOT NULL, "
            + "content TEXT NOT NULL, "
            + "theme_name TEXT NOT NULL, "
            + "created_at INTEGER NOT NULL, "
            + "word_count INTEGER NOT NULL)";

    @TempDir
    Path tempDir;

    private Path dbFile;
    private Connection conn;
    private MigrationEngine engine;

    @BeforeEach
    void setUp() throws SQLException {
        dbFile = tempDir.resolve("legacy.db");
        conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
        engine = new MigrationEngine(new StoreConfig(), Clock.fixed(Instant.ofEpochMilli(7_000), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws SQLException {
        conn.close();
    }

    @Test
    void migrate_legacyStore_shouldDropMarkersAndCreateThemes() throws SQLException {
        createLegacy(LEGACY_SCHEMA);
        insertLegacy("a", "设计");
        insertLegacy(Theme.THEME_MARKER, "设计");
        insertLegacy("b", "开发");

        engine.migrate(conn);

        assertEquals(Map.of("设计", 1, "开发", 1), themeCounts());
        assertEquals(List.of("a", "b"), contents());
        assertEquals(MigrationEngine.CURRENT_VERSION, userVersion());
    }

    @Test
    void migrate_legacyStore_shouldPreserveIdsAndAddForeignKey() throws SQLException {
        createLegacy(LEGACY_SCHEMA);
        insertLegacy("a", "设计");
        insertLegacy(Theme.THEME_MARKER, "设计");
        insertLegacy("b", "开发");

        engine.migrate(conn);

        assertEquals(List.of(1L, 3L), query("SELECT id FROM inspirations ORDER BY id", rs -> rs.getLong(1)));
        assertFalse(query("PRAGMA foreign_key_list(inspirations)", rs -> rs.getString("table")).isEmpty());
        assertEquals(2, query("PRAGMA index_list(inspirations)", rs -> rs.getString("name")).size());
    }

    @Test
    void migrate_blankLabel_shouldFileUnderDefaultTheme() throws SQLException {
        createLegacy(LEGACY_SCHEMA);
        insertLegacy("loose note", " ");
        insertLegacy("filed", "Work");

        engine.migrate(conn);

        assertEquals(Map.of("Uncategorized", 1, "Work", 1), themeCounts());
        assertEquals(List.of("Uncategorized"),
                query("SELECT theme_name FROM inspirations WHERE content = 'loose note'", rs -> rs.getString(1)));
    }

    @Test
    void migrate_invalidLabels_shouldFileUnderDefaultTheme() throws SQLException {
        createLegacy(LEGACY_SCHEMA);
        insertLegacy("real note", Theme.THEME_MARKER);
        insertLegacy("long label", "x".repeat(60));
        insertLegacy("filed", "Work");

        engine.migrate(conn);

        assertEquals(Map.of("Uncategorized", 2, "Work", 1), themeCounts());
        assertEquals(List.of("Uncategorized", "Uncategorized", "Work"),
                query("SELECT theme_name FROM inspirations ORDER BY id", rs -> rs.getString(1)));
        for (String name : themeCounts().keySet())
            assertTrue(Theme.validateName(name).isValid(), name);
    }

    @Test
    void migrate_markerOnlyTheme_shouldNotSurvive() throws SQLException {
        createLegacy(LEGACY_SCHEMA);
        insertLegacy(Theme.THEME_MARKER, "Empty");

        engine.migrate(conn);

        assertTrue(themeCounts().isEmpty());
        assertTrue(contents().isEmpty());
    }

    @Test
    void migrate_twice_shouldBeIdempotent() throws SQLException {
        createLegacy(LEGACY_SCHEMA);
        insertLegacy("a", "设计");

        engine.migrate(conn);
        engine.migrate(conn);

        assertEquals(Map.of("设计", 1), themeCounts());
        assertEquals(List.of("a"), contents());
    }

    @Test
    void migrate_emptyFile_shouldApplySchema() throws SQLException {
        engine.migrate(conn);

        assertEquals(MigrationEngine.CURRENT_VERSION, userVersion());
        assertTrue(themeCounts().isEmpty());
        assertTrue(contents().isEmpty());
    }

    @Test
    void migrate_brokenLegacyTable_shouldRollBackAndThrow() throws SQLException {
        // missing word_count, so the copy step fails
        createLegacy("CREATE TABLE inspirations (id INTEGER PRIMARY KEY, content TEXT, theme_name TEXT, "
                + "created_at INTEGER)");
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("INSERT INTO inspirations (content, theme_name, created_at) VALUES ('a', 'Work', 1)");
        }

        assertThrows(MigrationException.class, () -> engine.migrate(conn));

        assertEquals(MigrationEngine.LEGACY_VERSION, userVersion());
        assertTrue(query("SELECT name FROM sqlite_master WHERE name = 'themes'", rs -> rs.getString(1)).isEmpty());
        assertEquals(List.of("a"), contents());
    }

    @Test
    void open_legacyFile_shouldMigrateAndSeedDefaultTheme() throws SQLException {
        createLegacy(LEGACY_SCHEMA);
        insertLegacy("a", "设计");
        insertLegacy("b", "设计");
        conn.close();

        try (NoteDatabase database = NoteDatabase.open(dbFile, new StoreConfig(), Clock.systemUTC(),
                new ApplicationEventBus())) {
            ThemeCatalog catalog = new ThemeCatalog(database);
            InspirationStore store = new InspirationStore(database);

            assertEquals(2, catalog.get("设计").orElseThrow().inspirationCount());
            assertTrue(catalog.exists("Uncategorized"));
            assertEquals(2, store.countByTheme("设计"));
        }
        conn = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
    }

    // -- Helpers --

    private void createLegacy(String ddl) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ddl);
            stmt.execute("PRAGMA user_version = " + MigrationEngine.LEGACY_VERSION);
        }
    }

    private void insertLegacy(String content, String theme) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO inspirations (content, theme_name, created_at, word_count) VALUES (?, ?, ?, ?)")) {
            ps.setString(1, content);
            ps.setString(2, theme);
            ps.setLong(3, 1_000L);
            ps.setInt(4, 1);
            ps.executeUpdate();
        }
    }

    private Map<String, Integer> themeCounts() throws SQLException {
        Map<String, Integer> counts = new HashMap<>();
        if (query("SELECT name FROM sqlite_master WHERE name = 'themes'", rs -> rs.getString(1)).isEmpty())
            return counts;
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT name, inspirationCount FROM themes")) {
            while (rs.next())
                counts.put(rs.getString(1), rs.getInt(2));
        }
        return counts;
    }

    private List<String> contents() throws SQLException {
        return query("SELECT content FROM inspirations ORDER BY id", rs -> rs.getString(1));
    }

    private int userVersion() throws SQLException {
        return query("PRAGMA user_version", rs -> rs.getInt(1)).get(0);
    }

    private <T> List<T> query(String sql, RowMapper<T> mapper) throws SQLException {
        List<T> rows = new java.util.ArrayList<>();
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next())
                rows.add(mapper.map(rs));
        }
        return rows;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
