package com.pixelmelt.engine.stretch;

import com.pixelmelt.engine.image.Direction;
import com.pixelmelt.engine.image.PixelBuffer;
import com.pixelmelt.engine.image.StretchParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Runs the full stretch: rotate to canonical, build, rotate back, crop. The
 * output always has the input's dimensions. Any failure inside the pipeline
 * is logged and answered with an unmodified copy of the input.
 */
public class ImageStretcher {

    private static final Logger logger = LoggerFactory.getLogger(ImageStretcher.class);

    private final StretchParams defaults;

    public ImageStretcher() {
        this(new StretchParams(StretchParams.MAX_INTENSITY, 0, Direction.DOWN));
    }

    /**
     * @param defaults used in place of a null params argument
     */
    public ImageStretcher(StretchParams defaults) {
        this.defaults = defaults;
    }

    /**
     * Returns the stretched image, always sized like the source. Failures inside
     * the pipeline yield a copy of the source instead of an exception.
     *
     * @param params null uses this stretcher's defaults
     * @throws NullPointerException if source is null, the one input with no copy to return
     */
    public PixelBuffer stretchImage(PixelBuffer source, StretchParams params) {
        return stretch(source, params).getBuffer();
    }

    /**
     * Same as {@link #stretchImage} but also reports the outcome and effective params.
     *
     * @throws NullPointerException if source is null
     */
    public StretchResult stretch(PixelBuffer source, StretchParams params) {
        Objects.requireNonNull(source, "source buffer");
        try {
            return runPipeline(source, params != null ? params : defaults);
        } catch (RuntimeException | OutOfMemoryError e) {
            logger.error("Stretch of {} with {} failed, returning original", source, params, e);
            return new StretchResult(source.copy(), null, StretchResult.Outcome.FALLBACK, 0, source.getWidth(),
                    source.getHeight());
        }
    }

    private StretchResult runPipeline(PixelBuffer source, StretchParams params) {
        int width = source.getWidth();
        int height = source.getHeight();
        StretchParams effective = resolve(params, width, height);
        Direction direction = effective.getDirection();

        logger.info("Stretching {}x{}: intensity={}, startingPixel={}, direction={}", width, height,
                effective.getIntensity(), effective.getStartingPixel(), direction.toValue());

        int[] indexSequence = IndexSequenceGenerator.generate(effective.getIntensity());
        if (logger.isDebugEnabled()) {
            logger.debug("Index sequence length {}, starts {}", indexSequence.length,
                    Arrays.toString(Arrays.copyOf(indexSequence, Math.min(10, indexSequence.length))));
        }

        if (source.isEmpty()) {
            logger.info("Empty image, nothing to stretch");
            return noOp(source, effective, indexSequence.length);
        }

        OrientationNormalizer.CanonicalView view = OrientationNormalizer.toCanonical(source,
                effective.getStartingPixel(), direction);
        PixelBuffer working = view.getBuffer();
        int offset = view.getStartOffset();
        logger.debug("Canonical frame {}x{}, start row {}", working.getWidth(), working.getHeight(), offset);

        if (offset >= working.getHeight()) {
            logger.info("Start row {} is past the image, returning original", offset);
            return noOp(source, effective, indexSequence.length);
        }

        PixelBuffer built = StretchBuilder.build(indexSequence, working, offset);
        if (built.isEmpty()) {
            logger.info("No rows to stretch from row {}, returning original", offset);
            return noOp(source, effective, indexSequence.length);
        }

        PixelBuffer restored = OrientationNormalizer.fromCanonical(built, direction);
        PixelBuffer result = SizeNormalizer.crop(restored, width, height, direction);

        logger.info("Stretch complete: {}x{} stretched to {}x{}, cropped to {}x{}", width, height,
                restored.getWidth(), restored.getHeight(), result.getWidth(), result.getHeight());
        return new StretchResult(result, effective, StretchResult.Outcome.STRETCHED, indexSequence.length,
                restored.getWidth(), restored.getHeight());
    }

    private static StretchResult noOp(PixelBuffer source, StretchParams effective, int sequenceLength) {
        return new StretchResult(source.copy(), effective, StretchResult.Outcome.NO_OP, sequenceLength,
                source.getWidth(), source.getHeight());
    }

    /**
     * Clamps intensity and starting pixel and defaults a missing direction to DOWN.
     */
    static StretchParams resolve(StretchParams params, int width, int height) {
        Direction direction = params.getDirection();
        if (direction == null) {
            logger.warn("Direction not specified, defaulting to 'down'");
            direction = Direction.DOWN;
        }

        int intensity = StretchParams.clampIntensity(params.getIntensity());
        if (intensity != params.getIntensity()) {
            logger.warn("Intensity {} outside [{}, {}], clamped to {}", params.getIntensity(),
                    StretchParams.MIN_INTENSITY, StretchParams.MAX_INTENSITY, intensity);
        }

        int startingPixel = StretchParams.clampStartingPixel(params.getStartingPixel(), width, height, direction);
        if (startingPixel != params.getStartingPixel()) {
            logger.warn("Starting pixel {} outside [0, {}], clamped to {}", params.getStartingPixel(),
                    StretchParams.maxStartingPixel(width, height, direction), startingPixel);
        }
        return new StretchParams(intensity, startingPixel, direction);
    }
}
