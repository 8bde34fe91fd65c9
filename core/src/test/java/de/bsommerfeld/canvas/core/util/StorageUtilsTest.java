package de.bsommerfeld.canvas.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    @Test
    void getAppDataDir_shouldBeAbsoluteAndContainAppName() {
        Path dir = StorageUtils.getAppDataDir("test-app");
        assertTrue(dir.isAbsolute());
        assertTrue(dir.toString().contains("test-app"));
    }

    @Test
    void getLogsDir_shouldBeSubdirOfAppDataDir() {
        Path appDir = StorageUtils.getAppDataDir("test-app");
        assertEquals(appDir.resolve("logs"), StorageUtils.getLogsDir("test-app"));
    }

    @Test
    void getConfigFile_shouldBeTomlInAppDataDir() {
        Path appDir = StorageUtils.getAppDataDir("test-app");
        assertEquals(appDir.resolve("config.toml"), StorageUtils.getConfigFile("test-app"));
    }

    @Test
    void getAppDataDir_differentNames_shouldProduceDifferentPaths() {
        assertNotEquals(StorageUtils.getAppDataDir("app-one"), StorageUtils.getAppDataDir("app-two"));
    }
}
