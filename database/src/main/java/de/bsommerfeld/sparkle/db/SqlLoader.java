package de.bsommerfeld.sparkle.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads SQL from classpath resources under {@code sql/}. Statements are
 * addressed by file stem, e.g. {@code load("rename-theme")} reads
 * {@code sql/rename-theme.sql}; subdirectories are part of the name, as in
 * {@code load("migration/copy-legacy-inspirations")}.
 *
 * <p>
 * Every file is read once and cached for the lifetime of the JVM.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the trimmed content of {@code sql/<name>.sql}.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Returns the statements of a multi-statement script, split on semicolons
     * that end a line. Blank fragments are dropped.
     */
    public static List<String> loadStatements(String name) {
        List<String> statements = new ArrayList<>();
        for (String sql : load(name).split(";\\s*(\\r?\\n|$)")) {
            if (!sql.isBlank())
                statements.add(sql.trim());
        }
        return statements;
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
