package com.pixelmelt.engine.stretch;

import com.pixelmelt.engine.image.PixelBuffer;
import com.pixelmelt.engine.image.StretchParams;

public class StretchResult {

    public enum Outcome {
        STRETCHED,
        // offset at or past the processable edge, output equals input
        NO_OP,
        // an internal failure was recovered by returning the input
        FALLBACK
    }

    private final PixelBuffer buffer;
    private final StretchParams effectiveParams;
    private final Outcome outcome;
    private final int indexSequenceLength;
    private final int stretchedWidth;
    private final int stretchedHeight;

    public StretchResult(PixelBuffer buffer, StretchParams effectiveParams, Outcome outcome, int indexSequenceLength,
            int stretchedWidth, int stretchedHeight) {
        this.buffer = buffer;
        this.effectiveParams = effectiveParams;
        this.outcome = outcome;
        this.indexSequenceLength = indexSequenceLength;
        this.stretchedWidth = stretchedWidth;
        this.stretchedHeight = stretchedHeight;
    }

    public PixelBuffer getBuffer() {
        return buffer;
    }

    /**
     * Params after clamping, or null when the fail-safe fired before they were resolved.
     */
    public StretchParams getEffectiveParams() {
        return effectiveParams;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public int getIndexSequenceLength() {
        return indexSequenceLength;
    }

    /**
     * Width of the stretched image in the original orientation, before cropping.
     */
    public int getStretchedWidth() {
        return stretchedWidth;
    }

    public int getStretchedHeight() {
        return stretchedHeight;
    }
}
