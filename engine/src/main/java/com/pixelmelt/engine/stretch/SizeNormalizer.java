package com.pixelmelt.engine.stretch;

import com.pixelmelt.engine.image.Direction;
import com.pixelmelt.engine.image.PixelBuffer;

public class SizeNormalizer {

    /**
     * Crops a stretched buffer back to the original canvas. The window keeps the
     * side the stretch started from: the top for DOWN/RIGHT, the bottom for UP
     * and the right edge for LEFT. Reads past the buffer edge clamp to the last
     * row or column.
     */
    public static PixelBuffer crop(PixelBuffer stretched, int originalWidth, int originalHeight, Direction direction) {
        int width = stretched.getWidth();
        int height = stretched.getHeight();
        if (width == originalWidth && height == originalHeight) {
            return stretched;
        }

        PixelBuffer cropped = PixelBuffer.allocate(originalWidth, originalHeight);
        if (cropped.isEmpty()) {
            return cropped;
        }
        if (stretched.isEmpty()) {
            throw new IllegalArgumentException("Cannot crop empty " + stretched + " to " + originalWidth + "x"
                    + originalHeight);
        }

        int startX = 0;
        int startY = 0;
        switch (direction != null ? direction : Direction.DOWN) {
            case UP:
                startY = Math.max(0, height - originalHeight);
                break;
            case LEFT:
                startX = Math.max(0, width - originalWidth);
                break;
            default:
                break;
        }

        byte[] src = stretched.getData();
        byte[] dst = cropped.getData();
        for (int y = 0; y < originalHeight; y++) {
            int sourceY = Math.min(startY + y, height - 1);
            for (int x = 0; x < originalWidth; x++) {
                int sourceX = Math.min(startX + x, width - 1);
                System.arraycopy(src, (sourceY * width + sourceX) * PixelBuffer.CHANNELS,
                        dst, (y * originalWidth + x) * PixelBuffer.CHANNELS, PixelBuffer.CHANNELS);
            }
        }
        return cropped;
    }
}
