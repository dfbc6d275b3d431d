package com.depintel.core.analyzer;

import com.depintel.core.config.EngineConfig;
import com.depintel.core.exception.InvalidConfigurationException;
import com.depintel.core.metadata.MetadataProvider;
import com.depintel.core.model.DependencyGraph;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inputs of one analyzer run.
 *
 * @param projectId project being analyzed
 * @param graph dependency graph (read-only)
 * @param metadataProvider metadata source, for packages outside the graph (e.g. alternatives)
 * @param configuration job configuration overriding engine defaults
 * @param engineConfig engine configuration
 * @param clock reference clock; "now" for time-based analyses
 */
public record AnalysisContext(
    String projectId,
    DependencyGraph graph,
    MetadataProvider metadataProvider,
    Map<String, Object> configuration,
    EngineConfig engineConfig,
    Clock clock
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisContext {
        Objects.requireNonNull(projectId, "projectId must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(metadataProvider, "metadataProvider must not be null");
        configuration = configuration == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
        if (engineConfig == null) {
            engineConfig = EngineConfig.defaults();
        }
        if (clock == null) {
            clock = Clock.systemUTC();
        }
    }

    /**
     * @return current date according to the context clock
     */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Gets a configuration value.
     *
     * @param key configuration key
     * @param <T> expected type
     * @return configuration value, or null if not present
     */
    @SuppressWarnings("unchecked")
    public <T> T getConfig(String key) {
        return (T) configuration.get(key);
    }

    /**
     * Gets a configuration value with a default.
     *
     * @param key configuration key
     * @param defaultValue value used when the key is absent
     * @param <T> expected type
     * @return configuration value, or default if not present
     */
    public <T> T getConfigOrDefault(String key, T defaultValue) {
        T value = getConfig(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Reads a string option.
     *
     * @param key configuration key
     * @param defaultValue value used when the key is absent
     * @return trimmed string value
     */
    public String getString(String key, String defaultValue) {
        return readString(configuration, key, defaultValue);
    }

    /**
     * Reads an integer option given as a number or numeric string.
     *
     * @param key configuration key
     * @param defaultValue value used when the key is absent
     * @return integer value
     * @throws InvalidConfigurationException when the value is not an integer
     */
    public int getInt(String key, int defaultValue) {
        return readInt(configuration, key, defaultValue);
    }

    /**
     * Reads a decimal option given as a number or numeric string.
     *
     * @param key configuration key
     * @param defaultValue value used when the key is absent
     * @return double value
     * @throws InvalidConfigurationException when the value is not numeric
     */
    public double getDouble(String key, double defaultValue) {
        return readDouble(configuration, key, defaultValue);
    }

    /**
     * Reads a boolean option given as a boolean or "true"/"false".
     *
     * @param key configuration key
     * @param defaultValue value used when the key is absent
     * @return boolean value
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = configuration.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new InvalidConfigurationException("Configuration '" + key + "' must be a boolean: " + value);
    }

    /**
     * Reads a string option from a raw configuration map.
     *
     * @param configuration configuration map
     * @param key configuration key
     * @param defaultValue value used when the key is absent or blank
     * @return trimmed value
     */
    public static String readString(Map<String, Object> configuration, String key, String defaultValue) {
        Object value = configuration.get(key);
        if (value == null || value.toString().isBlank()) {
            return defaultValue;
        }
        return value.toString().trim();
    }

    /**
     * Reads an integer option from a raw configuration map.
     *
     * @param configuration configuration map
     * @param key configuration key
     * @param defaultValue value used when the key is absent
     * @return integer value
     */
    public static int readInt(Map<String, Object> configuration, String key, int defaultValue) {
        Object value = configuration.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Configuration '" + key + "' must be an integer: " + value);
        }
    }

    /**
     * Reads a decimal option from a raw configuration map.
     *
     * @param configuration configuration map
     * @param key configuration key
     * @param defaultValue value used when the key is absent
     * @return double value
     */
    public static double readDouble(Map<String, Object> configuration, String key, double defaultValue) {
        Object value = configuration.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Configuration '" + key + "' must be a number: " + value);
        }
    }
}
