package com.edgehistogram.server.service;

import com.edgehistogram.server.descriptor.EhdConfig;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Root of ehd_config.json. Absent fields keep their defaults.
 */
public class ServerConfig {

    public static final String RESOURCE = "/ehd_config.json";

    public static class DescriptorSettings {
        public Double threshold;
        public Boolean normalize;
        public Integer horizontalBlockCount;
        public Integer verticalBlockCount;
    }

    public static class CacheSettings {
        public Boolean enabled;
        public String version;
        // overrides <data_directory>/ehd_cache.db when set
        public String db_file;
    }

    public String data_directory;
    public DescriptorSettings descriptor;
    public CacheSettings cache;

    public static ServerConfig load(InputStream jsonStream) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return mapper.readValue(jsonStream, ServerConfig.class);
    }

    /**
     * Reads the classpath resource, falling back to an empty config when it is
     * missing.
     */
    public static ServerConfig loadDefault() {
        try (InputStream is = ServerConfig.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                return new ServerConfig();
            }
            return load(is);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read " + RESOURCE, e);
        }
    }

    public EhdConfig descriptorDefaults() {
        EhdConfig base = EhdConfig.defaults();
        if (descriptor == null) {
            return base;
        }
        return new EhdConfig(
                descriptor.threshold != null ? descriptor.threshold : base.getThreshold(),
                descriptor.normalize != null ? descriptor.normalize : base.isNormalize(),
                descriptor.horizontalBlockCount != null ? descriptor.horizontalBlockCount
                        : base.getHorizontalBlockCount(),
                descriptor.verticalBlockCount != null ? descriptor.verticalBlockCount
                        : base.getVerticalBlockCount());
    }

    public boolean isCacheEnabled() {
        return cache != null && Boolean.TRUE.equals(cache.enabled);
    }

    public String cacheVersion() {
        return cache != null && cache.version != null && !cache.version.isEmpty() ? cache.version : "v1";
    }
}
