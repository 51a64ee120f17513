package me.christianrobert.vbtranspiler.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String AI_ENABLED = "ai.enabled";
    public static final String AI_SERVER_URL = "ai.server-url";
    public static final String AI_API_KEY = "ai.api-key";
    public static final String AI_TIMEOUT_SECONDS = "ai.timeout-seconds";
    public static final String AI_CONNECTION_TEST_TIMEOUT_SECONDS = "ai.connection-test-timeout-seconds";
    public static final String REWRITE_INDENT_SIZE = "rewrite.indent-size";
    public static final String AST_MAX_DEPTH = "ast.max-depth";
    public static final String AST_MAX_CHILDREN = "ast.max-children";
    public static final String AST_MAX_TEXT_LENGTH = "ast.max-text-length";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(AI_ENABLED, true);
        configuration.put(AI_SERVER_URL, "");
        configuration.put(AI_API_KEY, "");
        configuration.put(AI_TIMEOUT_SECONDS, 30);
        configuration.put(AI_CONNECTION_TEST_TIMEOUT_SECONDS, 10);
        configuration.put(REWRITE_INDENT_SIZE, 4);
        configuration.put(AST_MAX_DEPTH, 50);
        configuration.put(AST_MAX_CHILDREN, 20);
        configuration.put(AST_MAX_TEXT_LENGTH, 100);

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
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
     * Gets a configuration value as an int.
     * Accepts numbers and numeric strings (values posted as JSON may arrive either way).
     *
     * @param key Configuration key
     * @param defaultValue Returned when the key is missing or not numeric
     * @return The configured value or the default
     */
    public int getConfigValueAsInt(String key, int defaultValue) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value for {} is not a number: '{}', using {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, masked(key, value), masked(key, oldValue));
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, masked(key, value), masked(key, oldValue));
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    private static Object masked(String key, Object value) {
        if (AI_API_KEY.equals(key) && value != null && !value.toString().isEmpty()) {
            return "****";
        }
        return value;
    }
}
