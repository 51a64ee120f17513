package me.christianrobert.vbtranspiler.config.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void defaults() {
        assertEquals(Boolean.TRUE, configService.getConfigValueAsBoolean(ConfigService.AI_ENABLED));
        assertEquals("", configService.getConfigValueAsString(ConfigService.AI_SERVER_URL));
        assertEquals(4, configService.getConfigValueAsInt(ConfigService.REWRITE_INDENT_SIZE, 0));
        assertEquals(30, configService.getConfigValueAsInt(ConfigService.AI_TIMEOUT_SECONDS, 0));
    }

    @Test
    void getConfigValueAsInt_acceptsNumericStrings() {
        configService.setConfigValue(ConfigService.REWRITE_INDENT_SIZE, " 2 ");
        assertEquals(2, configService.getConfigValueAsInt(ConfigService.REWRITE_INDENT_SIZE, 4));

        configService.setConfigValue(ConfigService.REWRITE_INDENT_SIZE, "two");
        assertEquals(4, configService.getConfigValueAsInt(ConfigService.REWRITE_INDENT_SIZE, 4));

        assertEquals(7, configService.getConfigValueAsInt("missing.key", 7));
    }

    @Test
    void getConfigValueAsBoolean_parsesStrings() {
        configService.setConfigValue(ConfigService.AI_ENABLED, "false");
        assertEquals(Boolean.FALSE, configService.getConfigValueAsBoolean(ConfigService.AI_ENABLED));

        configService.setConfigValue(ConfigService.AI_ENABLED, 1);
        assertNull(configService.getConfigValueAsBoolean(ConfigService.AI_ENABLED));
    }

    @Test
    void updateAndReset() {
        configService.updateConfiguration(Map.of(ConfigService.AI_SERVER_URL, "http://localhost:9000", "custom", 5));

        assertEquals("http://localhost:9000", configService.getConfigValueAsString(ConfigService.AI_SERVER_URL));
        assertTrue(configService.hasConfigKey("custom"));

        configService.resetToDefaults();

        assertEquals("", configService.getConfigValueAsString(ConfigService.AI_SERVER_URL));
        assertFalse(configService.hasConfigKey("custom"));
    }

    @Test
    void getAllConfiguration_returnsCopy() {
        Map<String, Object> all = configService.getAllConfiguration();
        all.put(ConfigService.AI_ENABLED, false);

        assertEquals(Boolean.TRUE, configService.getConfigValueAsBoolean(ConfigService.AI_ENABLED));
    }
}
