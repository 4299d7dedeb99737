package com.edgehistogram.server.service;

import com.edgehistogram.server.descriptor.EhdConfig;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ServerConfigLoadingTest {

    @Test
    public void testLoadConfigFromDefaultFile() {
        // test resources carry their own ehd_config.json
        ServerConfig config = ServerConfig.loadDefault();

        EhdConfig defaults = config.descriptorDefaults();
        assertEquals(40.0, defaults.getThreshold(), 1e-9);
        assertTrue(defaults.isNormalize());
        // not in the file, so the built-in default applies
        assertEquals(4, defaults.getHorizontalBlockCount());
        assertEquals(8, defaults.getVerticalBlockCount());

        assertFalse(config.isCacheEnabled());
        assertEquals("test-v1", config.cacheVersion());
        assertEquals("target", config.data_directory);
    }

    @Test
    public void testDefaultsForMissingSections() throws Exception {
        ServerConfig config = ServerConfig.load(new ByteArrayInputStream("{}".getBytes(StandardCharsets.UTF_8)));

        assertEquals(EhdConfig.defaults(), config.descriptorDefaults());
        assertFalse(config.isCacheEnabled());
        assertEquals("v1", config.cacheVersion());
    }

    @Test
    public void testServiceOverridesOnTopOfDefaults() {
        DescriptorService service = new DescriptorService();
        EhdConfig resolved = service.resolveConfig(null, false, 8, null);

        assertEquals(40.0, resolved.getThreshold(), 1e-9);
        assertFalse(resolved.isNormalize());
        assertEquals(8, resolved.getHorizontalBlockCount());
        assertEquals(8, resolved.getVerticalBlockCount());
    }
}
