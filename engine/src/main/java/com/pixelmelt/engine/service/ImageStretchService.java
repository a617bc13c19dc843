package com.pixelmelt.engine.service;

import com.pixelmelt.engine.image.Direction;
import com.pixelmelt.engine.image.PixelBuffer;
import com.pixelmelt.engine.image.StretchParams;
import com.pixelmelt.engine.stretch.ImageStretcher;
import com.pixelmelt.engine.stretch.StretchResult;
import com.pixelmelt.engine.util.StretchConfig;
import com.pixelmelt.engine.util.StretchConfigResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ImageStretchService {

    private static final Logger logger = LoggerFactory.getLogger(ImageStretchService.class);

    private StretchConfig config;
    private ImageStretcher stretcher;

    public ImageStretchService() {
    }

    public ImageStretchService(StretchConfig config) {
        this.config = config.copy();
    }

    /**
     * Returns a copy of the active configuration, loaded on first use.
     */
    public StretchConfig getConfig() {
        return activeConfig().copy();
    }

    private synchronized StretchConfig activeConfig() {
        if (config == null) {
            config = StretchConfigResolver.resolve();
            logger.info("Stretch defaults: intensity={}, direction={}, startingPixelFraction={}",
                    config.defaultIntensity, config.defaultDirection, config.startingPixelFraction);
        }
        return config;
    }

    private synchronized ImageStretcher getStretcher() {
        if (stretcher == null) {
            StretchConfig cfg = activeConfig();
            stretcher = new ImageStretcher(new StretchParams(StretchParams.clampIntensity(cfg.defaultIntensity), 0,
                    Direction.fromString(cfg.defaultDirection)));
        }
        return stretcher;
    }

    public PixelBuffer stretch(PixelBuffer image, StretchParams params) {
        return getStretcher().stretchImage(image, params);
    }

    public StretchResult stretchWithDetails(PixelBuffer image, StretchParams params) {
        StretchResult result = getStretcher().stretch(image, params);
        if (result.getOutcome() == StretchResult.Outcome.FALLBACK) {
            logger.warn("Stretch fell back to the original image for {}", image);
        }
        return result;
    }

    /**
     * Stretches with the parameters a freshly loaded image starts out with.
     */
    public PixelBuffer stretchWithDefaults(PixelBuffer image) {
        return stretch(image, defaultParams(image));
    }

    /**
     * Configured intensity and direction, starting pixel at the configured
     * fraction of the shorter side.
     */
    public StretchParams defaultParams(PixelBuffer image) {
        StretchConfig cfg = activeConfig();
        Direction direction = Direction.fromString(cfg.defaultDirection);
        int startingPixel = StretchParams.clampStartingPixel(
                defaultStartingPixel(image.getWidth(), image.getHeight(), cfg.startingPixelFraction),
                image.getWidth(), image.getHeight(), direction);
        return new StretchParams(StretchParams.clampIntensity(cfg.defaultIntensity), startingPixel, direction);
    }

    public int maxStartingPixel(PixelBuffer image, Direction direction) {
        return StretchParams.maxStartingPixel(image.getWidth(), image.getHeight(), direction);
    }

    public static int defaultStartingPixel(int width, int height, double fraction) {
        double f = Math.max(0.0, Math.min(fraction, 1.0));
        return (int) Math.floor(Math.min(width, height) * f);
    }
}
