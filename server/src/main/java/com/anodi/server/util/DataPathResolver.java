package com.anodi.server.util;

import com.anodi.server.config.EvaluationConfig;

import java.io.File;

public class DataPathResolver {

    public static final String DATA_DIR_PROPERTY = "anodi.data.dir";
    public static final String CACHE_ENABLED_PROPERTY = "anodi.cache.enabled";
    private static final String DEFAULT_DB_FILE = "anodi_cache.db";

    public static String resolveDataDirectory(EvaluationConfig config) {
        // 1. Check System Property
        String sysProp = System.getProperty(DATA_DIR_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        // 2. Check Config File
        if (config != null && config.anodi_data_directory != null && !config.anodi_data_directory.isEmpty()) {
            return config.anodi_data_directory;
        }

        // 3. Default
        return ".";
    }

    public static String resolveDbPath(EvaluationConfig config) {
        String fileName = DEFAULT_DB_FILE;
        if (config != null && config.cache != null && config.cache.fileName != null
                && !config.cache.fileName.isEmpty()) {
            fileName = config.cache.fileName;
        }
        return resolveDataDirectory(config) + File.separator + fileName;
    }

    public static boolean isCacheEnabled(EvaluationConfig config) {
        String sysProp = System.getProperty(CACHE_ENABLED_PROPERTY);
        if (sysProp != null && !sysProp.isEmpty()) {
            return Boolean.parseBoolean(sysProp);
        }
        return config != null && config.cache != null && Boolean.TRUE.equals(config.cache.enabled);
    }
}
