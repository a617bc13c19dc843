package com.pixelmelt.engine.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class StretchConfigResolver {

    private static final Logger logger = LoggerFactory.getLogger(StretchConfigResolver.class);

    public static final String CONFIG_PATH_PROPERTY = "pixelmelt.config";
    public static final String INTENSITY_PROPERTY = "pixelmelt.intensity";
    public static final String DIRECTION_PROPERTY = "pixelmelt.direction";
    public static final String CONFIG_RESOURCE = "/stretch_config.json";

    public static StretchConfig resolve() {
        StretchConfig config = load();
        applyOverrides(config);
        return config;
    }

    /**
     * Loads from the file named by the pixelmelt.config property, then the
     * classpath resource, then built-in defaults.
     */
    static StretchConfig load() {
        ObjectMapper mapper = new ObjectMapper();

        // 1. Explicit file
        String path = System.getProperty(CONFIG_PATH_PROPERTY);
        if (path != null && !path.isEmpty()) {
            File file = new File(path);
            try {
                StretchConfig config = mapper.readValue(file, StretchConfig.class);
                logger.info("Loaded stretch config from {}", file.getAbsolutePath());
                return config;
            } catch (IOException e) {
                logger.warn("Failed to read stretch config from {}: {}", file.getAbsolutePath(), e.getMessage());
            }
        }

        // 2. Classpath
        try (InputStream is = StretchConfigResolver.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is != null) {
                return mapper.readValue(is, StretchConfig.class);
            }
            logger.warn("{} not found on classpath, using defaults", CONFIG_RESOURCE);
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", CONFIG_RESOURCE, e.getMessage());
        }

        // 3. Default
        return StretchConfig.defaults();
    }

    static void applyOverrides(StretchConfig config) {
        String intensity = System.getProperty(INTENSITY_PROPERTY);
        if (intensity != null && !intensity.isEmpty()) {
            try {
                config.defaultIntensity = Integer.parseInt(intensity.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric {}='{}'", INTENSITY_PROPERTY, intensity);
            }
        }

        String direction = System.getProperty(DIRECTION_PROPERTY);
        if (direction != null && !direction.isEmpty()) {
            config.defaultDirection = direction;
        }
    }
}
