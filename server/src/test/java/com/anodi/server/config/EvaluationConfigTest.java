package com.anodi.server.config;

import com.anodi.server.ai.ConfigurationException;
import com.anodi.server.ai.EvaluationSettings;
import com.anodi.server.ai.TieBreak;
import com.anodi.server.ai.divergence.LogBase;
import com.anodi.server.util.DataPathResolver;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class EvaluationConfigTest {

    private static EvaluationConfig parse(String json) {
        return EvaluationConfig.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testBundledConfigParsing() {
        EvaluationConfig config = EvaluationConfig.loadDefault();
        assertNotNull(config.cache, "anodi_config.json not found on the classpath");
        assertNotNull(config.sampling);

        EvaluationSettings settings = config.toSettings();
        assertEquals(2, settings.getPatchSize());
        assertArrayEquals(new int[] { 1, 2, 4 }, settings.getFactors());
        assertEquals(TieBreak.ZERO, settings.getTieBreak());
        assertEquals(LogBase.NATURAL, settings.getLogBase());
        assertEquals("mean", settings.getCombinationPolicy().getName());
    }

    @Test
    public void testMissingFieldsTakeDefaults() {
        EvaluationSettings settings = parse("{\"someFutureField\": true}").toSettings();
        assertEquals(EvaluationSettings.DEFAULT_PATCH_SIZE, settings.getPatchSize());
        assertArrayEquals(new int[] { 1 }, settings.getFactors());
        assertTrue(settings.isParallel());
    }

    @Test
    public void testAlternateSpellings() {
        EvaluationSettings settings = parse("{\"patchSize\": 3, \"factors\": [1, 3], \"tieBreak\": \"1\", "
                + "\"logBase\": \"2\", \"parallel\": false}").toSettings();
        assertEquals(3, settings.getPatchSize());
        assertEquals(TieBreak.ONE, settings.getTieBreak());
        assertEquals(LogBase.BASE_2, settings.getLogBase());
        assertFalse(settings.isParallel());
    }

    @Test
    public void testUnknownValuesAreRejected() {
        assertThrows(ConfigurationException.class, () -> parse("{\"tieBreak\": \"random\"}").toSettings());
        assertThrows(ConfigurationException.class, () -> parse("{\"logBase\": \"10\"}").toSettings());
        assertThrows(ConfigurationException.class, () -> parse("{\"combination\": \"max\"}").toSettings());
        assertThrows(ConfigurationException.class, () -> parse("{\"patchSize\": 6}").toSettings());
        assertThrows(ConfigurationException.class, () -> parse("{\"factors\": []}").toSettings());
        assertThrows(RuntimeException.class, () -> parse("{not json"));
    }

    @Test
    public void testSystemPropertiesOverrideConfig() {
        EvaluationConfig config = parse("{\"anodi_data_directory\": \"/from/config\", "
                + "\"cache\": {\"enabled\": false, \"fileName\": \"c.db\"}}");
        assertEquals("/from/config", DataPathResolver.resolveDataDirectory(config));
        assertEquals("/from/config" + File.separator + "c.db", DataPathResolver.resolveDbPath(config));
        assertFalse(DataPathResolver.isCacheEnabled(config));

        System.setProperty(DataPathResolver.DATA_DIR_PROPERTY, "/from/property");
        System.setProperty(DataPathResolver.CACHE_ENABLED_PROPERTY, "true");
        try {
            assertEquals("/from/property", DataPathResolver.resolveDataDirectory(config));
            assertTrue(DataPathResolver.isCacheEnabled(config));
        } finally {
            System.clearProperty(DataPathResolver.DATA_DIR_PROPERTY);
            System.clearProperty(DataPathResolver.CACHE_ENABLED_PROPERTY);
        }
        assertEquals(".", DataPathResolver.resolveDataDirectory(new EvaluationConfig()));
    }
}
