package me.christianrobert.kugelblitz.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the translator switches. Values are read on every translation, so changes
 * take effect for the next call.
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String STRICT_TUPLES = "translator.strict-tuples";
    public static final String STRICT_FLOOR_DIVISION = "translator.strict-floor-division";
    public static final String STRICT_CLASS_MEMBERS = "translator.strict-class-members";
    public static final String INCLUDE_TREE = "translator.include-tree";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(STRICT_TUPLES, false);
        configuration.put(STRICT_FLOOR_DIVISION, false);
        configuration.put(STRICT_CLASS_MEMBERS, false);
        configuration.put(INCLUDE_TREE, false);

        log.info("Configuration service initialized with default values");
    }

    /**
     * Gets a boolean configuration value; string values are parsed.
     *
     * @return the value, or null when the key is missing or not boolean-like
     */
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
     * Gets a boolean configuration value, falling back when the key is missing
     * or holds something that is not a boolean.
     */
    public boolean getConfigValueAsBoolean(String key, boolean defaultValue) {
        Boolean value = getConfigValueAsBoolean(key);
        return value != null ? value : defaultValue;
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

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
