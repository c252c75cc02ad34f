package me.christianrobert.kugelblitz.config.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void translatorSwitchesDefaultToFalse() {
        assertFalse(configService.getConfigValueAsBoolean(ConfigService.STRICT_TUPLES));
        assertFalse(configService.getConfigValueAsBoolean(ConfigService.STRICT_FLOOR_DIVISION));
        assertFalse(configService.getConfigValueAsBoolean(ConfigService.STRICT_CLASS_MEMBERS));
        assertFalse(configService.getConfigValueAsBoolean(ConfigService.INCLUDE_TREE));
    }

    @Test
    void stringValuesAreParsedAsBooleans() {
        configService.setConfigValue(ConfigService.STRICT_TUPLES, "true");

        assertTrue(configService.getConfigValueAsBoolean(ConfigService.STRICT_TUPLES));
    }

    @Test
    void missingKeyFallsBackToDefault() {
        assertNull(configService.getConfigValueAsBoolean("translator.unknown"));
        assertTrue(configService.getConfigValueAsBoolean("translator.unknown", true));
    }

    @Test
    void updateConfigurationMergesEntries() {
        Map<String, Object> update = new HashMap<>();
        update.put(ConfigService.INCLUDE_TREE, true);
        update.put("custom.key", "value");

        configService.updateConfiguration(update);

        assertTrue(configService.getConfigValueAsBoolean(ConfigService.INCLUDE_TREE));
        assertFalse(configService.getConfigValueAsBoolean("custom.key"));
        assertFalse(configService.getConfigValueAsBoolean(ConfigService.STRICT_TUPLES));
    }

    @Test
    void resetRestoresDefaults() {
        configService.setConfigValue(ConfigService.STRICT_CLASS_MEMBERS, true);
        configService.setConfigValue("custom.key", true);

        configService.resetToDefaults();

        assertFalse(configService.getConfigValueAsBoolean(ConfigService.STRICT_CLASS_MEMBERS));
        assertNull(configService.getConfigValueAsBoolean("custom.key"));
    }

    @Test
    void nonBooleanValueFallsBackToDefault() {
        configService.setConfigValue(ConfigService.INCLUDE_TREE, 1);

        assertNull(configService.getConfigValueAsBoolean(ConfigService.INCLUDE_TREE));
        assertTrue(configService.getConfigValueAsBoolean(ConfigService.INCLUDE_TREE, true));
    }
}
