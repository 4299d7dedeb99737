package com.edgehistogram.server.util;

import com.edgehistogram.server.service.ServerConfig;

import java.io.File;

public class DataPathResolver {

    public static final String DATA_DIR_PROPERTY = "ehd.data.dir";
    public static final String DB_FILE_NAME = "ehd_cache.db";

    public static String resolveDataDirectory(ServerConfig config) {
        // 1. Check System Property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config File
        if (config != null && config.data_directory != null && !config.data_directory.isEmpty()) {
            return config.data_directory;
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath(ServerConfig config) {
        if (config != null && config.cache != null && config.cache.db_file != null
                && !config.cache.db_file.isEmpty()) {
            return config.cache.db_file;
        }
        return resolveDataDirectory(config) + File.separator + DB_FILE_NAME;
    }
}
