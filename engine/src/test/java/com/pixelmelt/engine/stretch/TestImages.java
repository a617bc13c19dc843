package com.pixelmelt.engine.stretch;

import com.pixelmelt.engine.image.PixelBuffer;
import com.pixelmelt.util.RgbaCodec;

final class TestImages {

    static final int BLACK = RgbaCodec.pack(0, 0, 0, 255);
    static final int WHITE = RgbaCodec.pack(255, 255, 255, 255);
    static final int GRAY = RgbaCodec.pack(128, 128, 128, 255);

    private TestImages() {
    }

    /**
     * A single column whose rows take the given colors.
     */
    static PixelBuffer column(int... colors) {
        int[][] rows = new int[colors.length][];
        for (int i = 0; i < colors.length; i++) {
            rows[i] = new int[] { colors[i] };
        }
        return PixelBuffer.fromRows(rows);
    }

    /**
     * A single row whose columns take the given colors.
     */
    static PixelBuffer row(int... colors) {
        return PixelBuffer.fromRows(new int[][] { colors });
    }

    /**
     * Deterministic multi-colored image with distinct pixels.
     */
    static PixelBuffer pattern(int width, int height) {
        int[][] rows = new int[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                rows[y][x] = RgbaCodec.pack((x * 37 + y * 11) & 0xFF, (x * 5 + y * 53) & 0xFF, (x * y * 7) & 0xFF,
                        255);
            }
        }
        return PixelBuffer.fromRows(rows);
    }

    static int[] columnColors(PixelBuffer buffer) {
        int[] colors = new int[buffer.getHeight()];
        for (int y = 0; y < colors.length; y++) {
            colors[y] = buffer.pixel(0, y);
        }
        return colors;
    }

    static int[] rowColors(PixelBuffer buffer) {
        int[] colors = new int[buffer.getWidth()];
        for (int x = 0; x < colors.length; x++) {
            colors[x] = buffer.pixel(x, 0);
        }
        return colors;
    }
}
