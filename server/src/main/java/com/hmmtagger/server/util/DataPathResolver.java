package com.hmmtagger.server.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Locates the directory holding the SQLite result cache. The
 * {@code hmm.data.dir} system property wins over {@code hmm_data_directory}
 * from the configuration; the working directory is the fallback.
 */
public final class DataPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(DataPathResolver.class);

    public static final String DATA_DIR_PROPERTY = "hmm.data.dir";
    public static final String DB_FILE_NAME = "hmm_cache.db";

    private DataPathResolver() {
    }

    public static Path resolveDataDirectory(String configuredDirectory) {
        String dir = System.getProperty(DATA_DIR_PROPERTY);
        if (isBlank(dir)) {
            dir = configuredDirectory;
        }
        if (isBlank(dir)) {
            dir = ".";
        }
        return Paths.get(dir);
    }

    /**
     * Path of the cache database, creating its directory if needed.
     */
    public static String resolveDbPath(String configuredDirectory) {
        Path dir = resolveDataDirectory(configuredDirectory);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            logger.warn("Could not create data directory {}: {}", dir, e.getMessage());
        }
        return dir.resolve(DB_FILE_NAME).toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
