package de.bsommerfeld.sparkle.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void storeConfig_shouldInitializeWithDefaults() {
        StoreConfig config = new StoreConfig();

        assertEquals("sparkle-note.db", config.getDatabaseFile());
        assertEquals("Uncategorized", config.getDefaultThemeName());
        assertEquals(4283076834L, config.getDefaultThemeColor());
        assertEquals(30, config.getShutdownTimeoutSeconds());
    }

    @Test
    void load_missingFile_shouldWriteDefaults() throws Exception {
        Path configPath = tempDir.resolve("nested").resolve("config.toml");

        StoreConfig config = ConfigLoader.load(configPath);

        assertEquals("Uncategorized", config.getDefaultThemeName());
        assertTrue(Files.exists(configPath));
        String written = Files.readString(configPath, StandardCharsets.UTF_8);
        assertTrue(written.contains("default-theme-name"));
        assertTrue(written.contains("database-file"));
    }

    @Test
    void load_existingFile_shouldReadValues() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, String.join("\n",
                "database-file = 'notes.db'",
                "default-theme-name = 'Inbox'",
                "shutdown-timeout-seconds = 5",
                ""), StandardCharsets.UTF_8);

        StoreConfig config = ConfigLoader.load(configPath);

        assertEquals("notes.db", config.getDatabaseFile());
        assertEquals("Inbox", config.getDefaultThemeName());
        assertEquals(5, config.getShutdownTimeoutSeconds());
        // untouched keys keep their defaults
        assertEquals(4283076834L, config.getDefaultThemeColor());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        Files.writeString(configPath, "legacy-option = true\n", StandardCharsets.UTF_8);

        StoreConfig config = ConfigLoader.load(configPath);
        assertEquals("sparkle-note.db", config.getDatabaseFile());
    }

    @Test
    void load_roundTripOfWrittenDefaults_shouldMatch() throws Exception {
        Path configPath = tempDir.resolve("config.toml");
        ConfigLoader.load(configPath);

        StoreConfig reloaded = ConfigLoader.load(configPath);

        assertEquals(new StoreConfig().getDefaultThemeIcon(), reloaded.getDefaultThemeIcon());
        assertEquals(new StoreConfig().getDefaultThemeColor(), reloaded.getDefaultThemeColor());
    }

    @Test
    void defaultTheme_shouldUseConfiguredMetadata() {
        StoreConfig config = new StoreConfig();
        config.setDefaultThemeName("Inbox");
        config.setDefaultThemeIcon("📥");

        var theme = config.defaultTheme(42L);

        assertEquals("Inbox", theme.name());
        assertEquals("📥", theme.icon());
        assertEquals(42L, theme.lastUsed());
        assertEquals(0, theme.inspirationCount());
    }
}
