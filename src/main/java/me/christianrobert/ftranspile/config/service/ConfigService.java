package me.christianrobert.ftranspile.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.ftranspile.codegen.CodegenOptions;
import me.christianrobert.ftranspile.frontend.context.FrontendConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String STRICT_MODE = "frontend.strict-mode";
    public static final String PREPROCESSING_RULES = "frontend.preprocessing-rules";
    public static final String LINEWIDTH = "codegen.linewidth";
    public static final String CHUNKING = "codegen.chunking";
    public static final String CONSERVATIVE = "codegen.conservative";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(STRICT_MODE, false);
        configuration.put(PREPROCESSING_RULES, "macro-marker");
        configuration.put(LINEWIDTH, CodegenOptions.DEFAULT_LINEWIDTH);
        configuration.put(CHUNKING, CodegenOptions.DEFAULT_CHUNKING);
        configuration.put(CONSERVATIVE, false);

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a configuration value as an integer. Accepts numbers and numeric strings.
     *
     * @param key Configuration key
     * @return the value, or null if it is missing or not numeric
     */
    public Integer getConfigValueAsInteger(String key) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} = '{}' is not a number", key, value);
                return null;
            }
        }
        return null;
    }

    /**
     * Gets a configuration value as a list of strings.
     * Supports comma-separated values: "rule-a,rule-b"
     * Trims whitespace and filters out empty strings.
     *
     * @param key Configuration key
     * @return List of strings, or empty list if value is null/empty
     */
    public List<String> getConfigValueAsStringList(String key) {
        Object value = configuration.get(key);
        if (value == null || value.toString().trim().isEmpty()) {
            return new ArrayList<>();
        }

        return Arrays.stream(value.toString().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    /**
     * Front-end settings from the current values.
     */
    public FrontendConfig getFrontendConfig() {
        return FrontendConfig.of(Boolean.TRUE.equals(getConfigValueAsBoolean(STRICT_MODE)));
    }

    /**
     * Code generator settings from the current values; missing or invalid entries fall back to the defaults.
     */
    public CodegenOptions getCodegenOptions() {
        Integer linewidth = getConfigValueAsInteger(LINEWIDTH);
        Integer chunking = getConfigValueAsInteger(CHUNKING);
        return new CodegenOptions(
                linewidth != null ? linewidth : CodegenOptions.DEFAULT_LINEWIDTH,
                chunking != null ? chunking : CodegenOptions.DEFAULT_CHUNKING,
                Boolean.TRUE.equals(getConfigValueAsBoolean(CONSERVATIVE)));
    }
}
