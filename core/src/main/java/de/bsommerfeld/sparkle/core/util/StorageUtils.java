package de.bsommerfeld.sparkle.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves where the note store keeps its database and configuration.
 *
 * <p>
 * The system property {@value #DATA_DIR_PROPERTY} wins when set. Otherwise the
 * platform convention applies:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}}</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}}, falling back
 * to {@code ~/.local/share/{appName}}</li>
 * </ul>
 * Directories are not created here.
 */
public final class StorageUtils {

    public static final String DATA_DIR_PROPERTY = "sparkle.data.dir";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String override = System.getProperty(DATA_DIR_PROPERTY);
        if (override != null && !override.isBlank())
            return Paths.get(override).toAbsolutePath();

        String home = System.getProperty("user.home");
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin"))
            return Paths.get(home, "Library", "Application Support", appName);

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(home, "AppData", "Roaming", appName);
        }

        String xdgData = System.getenv("XDG_DATA_HOME");
        return xdgData != null && !xdgData.isEmpty()
                ? Paths.get(xdgData, appName)
                : Paths.get(home, ".local", "share", appName);
    }

    /** Location of {@code config.toml} inside the data directory. */
    public static Path getConfigFile(String appName) {
        return getAppDataDir(appName).resolve("config.toml");
    }
}
