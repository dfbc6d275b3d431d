package com.depintel.core.config;

import com.depintel.core.exception.InvalidConfigurationException;
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
 * <p>Uses Jackson to deserialize {@code depintel.yaml} into {@link EngineConfig} records.
 * A missing or unreadable file yields {@link EngineConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EngineConfig config = ConfigLoader.load(Paths.get("depintel.yaml"));
 * int limit = config.engine().maxConcurrentJobsPerProject();
 * }</pre>
 */
public final class ConfigLoader {

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "depintel.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link EngineConfig#defaults()}. Values that parse but break a constraint (negative
     * weights, weights not summing to 1) are not silently replaced: the
     * {@link InvalidConfigurationException} propagates.
     *
     * @param configPath path to {@code depintel.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static EngineConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            EngineConfig config = YAML_MAPPER.readValue(configPath.toFile(), EngineConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return EngineConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            if (e.getCause() instanceof InvalidConfigurationException invalid) {
                throw invalid;
            }
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return EngineConfig.defaults();
        }
    }
}
