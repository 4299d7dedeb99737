package com.edgehistogram.server.service;

import com.edgehistogram.server.descriptor.DescriptorPart;
import com.edgehistogram.server.descriptor.EhdConfig;
import com.edgehistogram.server.descriptor.GrayImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class DescriptorServiceTest {

    @TempDir
    Path tempDir;

    private DescriptorService service;
    private CacheControlService cacheControl;

    static ServerConfig cachedConfig(Path dir) {
        ServerConfig config = new ServerConfig();
        config.cache = new ServerConfig.CacheSettings();
        config.cache.enabled = true;
        config.cache.version = "v7";
        config.cache.db_file = dir.resolve("ehd_cache.db").toString();
        return config;
    }

    static GrayImage horizontalStripes() {
        double[][] px = new double[16][16];
        for (int r = 0; r < 16; r++) {
            for (int c = 0; c < 16; c++) {
                px[r][c] = (r % 2 == 0) ? 200 : 0;
            }
        }
        return GrayImage.fromSamples(px);
    }

    @BeforeEach
    public void setup() {
        service = new DescriptorService(cachedConfig(tempDir));
        service.init();
        cacheControl = new CacheControlService(service);
    }

    @Test
    public void testCacheInitialized() {
        assertTrue(service.isCacheReady());
        assertEquals("v7", service.getVersion());
        assertEquals(EhdConfig.defaults(), service.getDefaults());
    }

    @Test
    public void testDescribeReportsCacheHits() {
        GrayImage img = horizontalStripes();
        EhdConfig cfg = service.getDefaults();

        DescriptorResult first = service.describe(img, cfg, DescriptorPart.GLOBAL);
        assertFalse(first.isCacheHit());
        assertEquals("global", first.getPart());
        assertEquals(img.contentHash(), first.getImageHash());
        // 64 cells, all horizontal
        assertArrayEquals(new double[] { 0, 64, 0, 0, 0 }, first.getVector(), 1e-12);

        DescriptorResult second = service.describe(img, cfg, DescriptorPart.GLOBAL);
        assertTrue(second.isCacheHit());
        assertArrayEquals(first.getVector(), second.getVector(), 1e-12);

        // another configuration misses
        assertFalse(service.describe(img, cfg.withThreshold(10), DescriptorPart.GLOBAL).isCacheHit());
    }

    @Test
    public void testResolveConfigOverridesOnlyGivenFields() {
        EhdConfig resolved = service.resolveConfig(null, true, null, 8);
        assertEquals(new EhdConfig(50.0, true, 4, 8), resolved);
        assertEquals(service.getDefaults(), service.resolveConfig(null, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> service.resolveConfig(-1.0, null, null, null));
    }

    @Test
    public void testFullVectorLength() {
        DescriptorResult result = service.describe(horizontalStripes(), new EhdConfig(50, true, 8, 4),
                DescriptorPart.FULL);
        assertEquals(DescriptorPart.FULL.vectorLength(8, 4), result.getLength());
        assertEquals(5 + 5 * 17 + 5 * 32, result.getLength());
    }

    @Test
    public void testCacheControlClearsRows() {
        GrayImage stripes = horizontalStripes();
        GrayImage flat = GrayImage.fromSamples(new double[16][16]);
        EhdConfig cfg = service.getDefaults();
        service.describe(stripes, cfg, DescriptorPart.GLOBAL);
        service.describe(flat, cfg, DescriptorPart.GLOBAL);
        service.describe(stripes, cfg, DescriptorPart.BLOCKS);
        service.describe(flat, cfg, DescriptorPart.BLOCKS);

        assertEquals(2, cacheControl.clearDescriptor(DescriptorPart.GLOBAL, cfg));
        assertEquals(0, cacheControl.clearDescriptor(DescriptorPart.GLOBAL, cfg));
        assertEquals(1, cacheControl.clearImage(flat.contentHash()));
        assertEquals(1, cacheControl.clearAll());
        assertFalse(service.describe(stripes, cfg, DescriptorPart.BLOCKS).isCacheHit());
    }

    @Test
    public void testCacheControlRequiresCache() {
        DescriptorService uncached = new DescriptorService(new ServerConfig());
        uncached.init();
        assertFalse(uncached.isCacheReady());

        CacheControlService control = new CacheControlService(uncached);
        assertThrows(IllegalStateException.class, control::clearAll);

        // uncached service still computes
        DescriptorResult r = uncached.describe(horizontalStripes(), uncached.getDefaults(), DescriptorPart.GLOBAL);
        DescriptorResult again = uncached.describe(horizontalStripes(), uncached.getDefaults(), DescriptorPart.GLOBAL);
        assertFalse(r.isCacheHit());
        assertFalse(again.isCacheHit());
        assertNull(again.getImageHash());
    }
}
