package com.pixelmelt.engine.stretch;

import com.pixelmelt.engine.image.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Builds the stretched image in the canonical (downward) frame. Rows above the
 * start offset are copied; from the offset on, each pair of adjacent source
 * rows is replaced by a gradient run whose length comes from the index
 * sequence.
 */
public class StretchBuilder {

    private static final Logger logger = LoggerFactory.getLogger(StretchBuilder.class);

    /**
     * Number of rows the build will produce for this sequence, source height and offset.
     */
    public static int outputHeight(int[] indexSequence, int height, int startOffset) {
        long newHeight = startOffset;
        int steps = Math.min(indexSequence.length, height - startOffset - 1);
        for (int i = 0; i < steps; i++) {
            newHeight += indexSequence[i] + 1L;
        }
        return Math.toIntExact(newHeight);
    }

    public static PixelBuffer build(int[] indexSequence, PixelBuffer source, int startOffset) {
        int width = source.getWidth();
        int height = source.getHeight();
        if (startOffset < 0 || startOffset > height) {
            throw new IllegalArgumentException("Start offset " + startOffset + " outside [0, " + height + "]");
        }

        int newHeight = outputHeight(indexSequence, height, startOffset);
        int stride = source.rowStride();
        byte[] src = source.getData();
        byte[] out = new byte[PixelBuffer.byteLength(width, newHeight)];

        logger.debug("Building stretch: {}x{} from row {}, sequence length {}, output height {}",
                width, height, startOffset, indexSequence.length, newHeight);

        System.arraycopy(src, 0, out, 0, startOffset * stride);

        int cursor = startOffset;
        int j = 0;
        for (int sourceRow = startOffset; sourceRow < height - 1 && j < indexSequence.length; sourceRow++) {
            if (cursor >= newHeight) {
                break;
            }
            byte[][] run = RowGradientInterpolator.interpolate(source.row(sourceRow), source.row(sourceRow + 1),
                    indexSequence[j], width);

            // last row of the run is the next pair's first row
            for (int r = 0; r < run.length - 1 && cursor < newHeight; r++) {
                System.arraycopy(run[r], 0, out, cursor * stride, stride);
                cursor++;
            }
            j++;
        }

        if (cursor < newHeight) {
            logger.debug("Source rows exhausted at output row {} of {}", cursor, newHeight);
            out = Arrays.copyOf(out, PixelBuffer.byteLength(width, cursor));
        }
        return new PixelBuffer(out, width, cursor);
    }
}
