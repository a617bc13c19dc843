package com.pixelmelt.engine.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class StretchConfigResolverTest {

    @AfterEach
    public void clearProperties() {
        System.clearProperty(StretchConfigResolver.CONFIG_PATH_PROPERTY);
        System.clearProperty(StretchConfigResolver.INTENSITY_PROPERTY);
        System.clearProperty(StretchConfigResolver.DIRECTION_PROPERTY);
    }

    @Test
    public void testLoadsClasspathConfig() {
        // src/test/resources/stretch_config.json
        StretchConfig config = StretchConfigResolver.resolve();
        assertEquals(9, config.defaultIntensity);
        assertEquals("up", config.defaultDirection);
        assertEquals(0.25, config.startingPixelFraction, 1e-9);
    }

    @Test
    public void testExplicitFileWins(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.json");
        Files.write(file, "{\"defaultIntensity\": 3, \"defaultDirection\": \"left\", \"unknownKey\": true}"
                .getBytes(StandardCharsets.UTF_8));
        System.setProperty(StretchConfigResolver.CONFIG_PATH_PROPERTY, file.toString());

        StretchConfig config = StretchConfigResolver.resolve();
        assertEquals(3, config.defaultIntensity);
        assertEquals("left", config.defaultDirection);
        // missing keys keep their defaults
        assertEquals(0.5, config.startingPixelFraction, 1e-9);
    }

    @Test
    public void testMissingFileFallsBackToClasspath(@TempDir Path dir) {
        System.setProperty(StretchConfigResolver.CONFIG_PATH_PROPERTY, dir.resolve("absent.json").toString());
        assertEquals(9, StretchConfigResolver.resolve().defaultIntensity);
    }

    @Test
    public void testSystemPropertyOverrides() {
        System.setProperty(StretchConfigResolver.INTENSITY_PROPERTY, "4");
        System.setProperty(StretchConfigResolver.DIRECTION_PROPERTY, "right");

        StretchConfig config = StretchConfigResolver.resolve();
        assertEquals(4, config.defaultIntensity);
        assertEquals("right", config.defaultDirection);
    }

    @Test
    public void testNonNumericIntensityIgnored() {
        System.setProperty(StretchConfigResolver.INTENSITY_PROPERTY, "lots");
        assertEquals(9, StretchConfigResolver.resolve().defaultIntensity);
    }

    @Test
    public void testDefaults() {
        StretchConfig config = StretchConfig.defaults();
        assertEquals(13, config.defaultIntensity);
        assertEquals("right", config.defaultDirection);
        assertEquals(0.5, config.startingPixelFraction, 1e-9);

        StretchConfig copy = config.copy();
        copy.defaultIntensity = 2;
        assertEquals(13, config.defaultIntensity);
    }
}
