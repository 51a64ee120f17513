package me.christianrobert.vbtranspiler.config.rest;

import me.christianrobert.vbtranspiler.config.service.ConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigRestServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        configService.setConfigValue(ConfigService.AI_API_KEY, "sk-real");
    }

    // ========== Masking ==========

    @Test
    void mask_hidesConfiguredApiKey() {
        assertEquals(ConfigRestService.MASKED_SECRET, ConfigRestService.mask(ConfigService.AI_API_KEY, "sk-real"));
        assertEquals("", ConfigRestService.mask(ConfigService.AI_API_KEY, ""));
        assertEquals("http://ai", ConfigRestService.mask(ConfigService.AI_SERVER_URL, "http://ai"));
    }

    // ========== Saving ==========

    @Test
    void withoutMaskedSecrets_keepsStoredKeyWhenFormIsSavedBack() {
        Map<String, Object> posted = new HashMap<>();
        posted.put(ConfigService.AI_API_KEY, ConfigRestService.MASKED_SECRET);
        posted.put(ConfigService.AI_SERVER_URL, "http://ai");

        Map<String, Object> filtered = ConfigRestService.withoutMaskedSecrets(posted);
        configService.updateConfiguration(filtered);

        assertFalse(filtered.containsKey(ConfigService.AI_API_KEY));
        assertEquals("sk-real", configService.getConfigValueAsString(ConfigService.AI_API_KEY));
        assertEquals("http://ai", configService.getConfigValueAsString(ConfigService.AI_SERVER_URL));
        assertEquals(ConfigRestService.MASKED_SECRET, posted.get(ConfigService.AI_API_KEY));
    }

    @Test
    void withoutMaskedSecrets_acceptsNewKey() {
        Map<String, Object> posted = new HashMap<>();
        posted.put(ConfigService.AI_API_KEY, "sk-new");

        configService.updateConfiguration(ConfigRestService.withoutMaskedSecrets(posted));

        assertEquals("sk-new", configService.getConfigValueAsString(ConfigService.AI_API_KEY));
    }

    @Test
    void isMaskedSecret_onlyForApiKey() {
        assertTrue(ConfigRestService.isMaskedSecret(ConfigService.AI_API_KEY, ConfigRestService.MASKED_SECRET));
        assertFalse(ConfigRestService.isMaskedSecret(ConfigService.AI_SERVER_URL, ConfigRestService.MASKED_SECRET));
        assertFalse(ConfigRestService.isMaskedSecret(ConfigService.AI_API_KEY, "sk-new"));
    }
}
