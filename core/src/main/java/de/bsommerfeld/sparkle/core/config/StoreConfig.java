package de.bsommerfeld.sparkle.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.sparkle.core.domain.Theme;

/**
 * Settings for the note store, read from {@code config.toml} by
 * {@link ConfigLoader}. Every field carries a default so a missing or partial
 * file still yields a usable configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreConfig {

    @JsonProperty("database-file")
    private String databaseFile = "sparkle-note.db";

    @JsonProperty("default-theme-name")
    private String defaultThemeName = "Uncategorized";

    @JsonProperty("default-theme-icon")
    private String defaultThemeIcon = Theme.DEFAULT_ICON;

    @JsonProperty("default-theme-color")
    private long defaultThemeColor = Theme.DEFAULT_COLOR;

    @JsonProperty("shutdown-timeout-seconds")
    private int shutdownTimeoutSeconds = 30;

    /** Database file name, resolved against the application data directory. */
    public String getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(String databaseFile) {
        this.databaseFile = databaseFile;
    }

    /**
     * Name of the fallback theme. It is seeded on store open, cannot be
     * deleted or renamed, and receives the inspirations of deleted themes.
     */
    public String getDefaultThemeName() {
        return defaultThemeName;
    }

    public void setDefaultThemeName(String defaultThemeName) {
        this.defaultThemeName = defaultThemeName;
    }

    public String getDefaultThemeIcon() {
        return defaultThemeIcon;
    }

    public void setDefaultThemeIcon(String defaultThemeIcon) {
        this.defaultThemeIcon = defaultThemeIcon;
    }

    public long getDefaultThemeColor() {
        return defaultThemeColor;
    }

    public void setDefaultThemeColor(long defaultThemeColor) {
        this.defaultThemeColor = defaultThemeColor;
    }

    /** How long {@code close()} waits for queued writes before giving up. */
    public int getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
    }

    /** Builds the default theme as seeded on store open. */
    public Theme defaultTheme(long now) {
        return new Theme(defaultThemeName, defaultThemeIcon, defaultThemeColor, "", now, now, 0);
    }
}
