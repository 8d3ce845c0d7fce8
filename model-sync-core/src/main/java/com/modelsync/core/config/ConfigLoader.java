package com.modelsync.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading engine configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code model-sync.yaml} into {@link ModelSyncConfig}.
 * If the config file is missing or invalid, returns {@link ModelSyncConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ModelSyncConfig config = ConfigLoader.load(Paths.get("model-sync.yaml"));
 * long debounce = config.sync().textDebounceMs();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link ModelSyncConfig#defaults()}.
     *
     * @param configPath path to {@code model-sync.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ModelSyncConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ModelSyncConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ModelSyncConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ModelSyncConfig config = YAML_MAPPER.readValue(configPath.toFile(), ModelSyncConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ModelSyncConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ModelSyncConfig.defaults();
        }
    }
}
