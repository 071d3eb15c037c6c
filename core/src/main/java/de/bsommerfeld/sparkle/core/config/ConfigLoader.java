package de.bsommerfeld.sparkle.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link StoreConfig} from a TOML file. When the file does not exist
 * yet, the defaults are written to it so users have a template to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration at {@code configPath}, creating the file (and
     * its parent directories) with default values if it is missing.
     *
     * @throws IOException if the file exists but cannot be read or parsed,
     *                     or the defaults cannot be written
     */
    public static StoreConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            StoreConfig defaults = new StoreConfig();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null)
                Files.createDirectories(parent);
            MAPPER.writeValue(configPath.toFile(), defaults);
            LOG.info("Wrote default configuration to {}", configPath.toAbsolutePath());
            return defaults;
        }

        LOG.info("Loading configuration from {}", configPath.toAbsolutePath());
        return MAPPER.readValue(configPath.toFile(), StoreConfig.class);
    }
}
