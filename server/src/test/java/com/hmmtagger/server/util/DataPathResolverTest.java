package com.hmmtagger.server.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class DataPathResolverTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperty() {
        System.clearProperty(DataPathResolver.DATA_DIR_PROPERTY);
    }

    @Test
    void testFallsBackToWorkingDirectory() {
        assertEquals(Paths.get("."), DataPathResolver.resolveDataDirectory(null));
        assertEquals(Paths.get("."), DataPathResolver.resolveDataDirectory("  "));
    }

    @Test
    void testConfiguredDirectoryUsed() {
        assertEquals(Paths.get("data"), DataPathResolver.resolveDataDirectory("data"));
    }

    @Test
    void testSystemPropertyWins() {
        System.setProperty(DataPathResolver.DATA_DIR_PROPERTY, tempDir.toString());
        assertEquals(tempDir, DataPathResolver.resolveDataDirectory("data"));
    }

    @Test
    void testDbPathCreatesDirectory() {
        Path nested = tempDir.resolve("cache").resolve("v1");
        String dbPath = DataPathResolver.resolveDbPath(nested.toString());

        assertTrue(Files.isDirectory(nested));
        assertEquals(nested.resolve(DataPathResolver.DB_FILE_NAME).toString(), dbPath);
    }
}
