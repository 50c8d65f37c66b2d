package de.bsommerfeld.assetledger.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GlobalConfig} from a TOML file. A missing file is created with
 * the default values so users have something to edit. Unknown keys are
 * ignored, which keeps old config files loadable after settings are removed.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration at {@code path}, writing defaults first if the
     * file does not exist yet.
     *
     * @throws ConfigurationException if the file is unreadable or malformed
     */
    public static GlobalConfig load(Path path) {
        try {
            if (!Files.exists(path)) {
                GlobalConfig defaults = new GlobalConfig();
                save(defaults, path);
                LOG.info("Wrote default configuration to {}", path);
                return defaults;
            }
            GlobalConfig config = MAPPER.readValue(path.toFile(), GlobalConfig.class);
            LOG.info("Loaded configuration from {}", path);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from " + path, e);
        }
    }

    /**
     * Writes {@code config} to {@code path}, creating parent directories.
     *
     * @throws ConfigurationException if the file cannot be written
     */
    public static void save(GlobalConfig config, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(path.toFile(), config);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to write configuration to " + path, e);
        }
    }
}
