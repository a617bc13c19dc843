package com.pixelmelt.engine.stretch;

import com.pixelmelt.engine.image.PixelBuffer;

public class RowGradientInterpolator {

    private static final int OPAQUE = 255;

    /**
     * Produces gradientSize + 2 rows: rowA, the linear blends from A toward B,
     * then rowB. Blended rows are always fully opaque.
     *
     * @param rowA         RGBA row of width pixels
     * @param rowB         RGBA row of width pixels
     * @param gradientSize number of blended rows between A and B
     * @param width        pixels per row
     */
    public static byte[][] interpolate(byte[] rowA, byte[] rowB, int gradientSize, int width) {
        if (gradientSize < 0) {
            throw new IllegalArgumentException("Gradient size must be non-negative, got " + gradientSize);
        }
        int stride = Math.multiplyExact(width, PixelBuffer.CHANNELS);
        if (rowA.length != stride || rowB.length != stride) {
            throw new IllegalArgumentException("Row lengths " + rowA.length + "/" + rowB.length
                    + " do not match width " + width);
        }

        byte[][] run = new byte[gradientSize + 2][];
        run[0] = rowA.clone();
        run[gradientSize + 1] = rowB.clone();

        int steps = gradientSize + 1;
        for (int k = 1; k <= gradientSize; k++) {
            byte[] row = new byte[stride];
            for (int o = 0; o < stride; o += PixelBuffer.CHANNELS) {
                for (int c = 0; c < 3; c++) {
                    int start = rowA[o + c] & 0xFF;
                    int end = rowB[o + c] & 0xFF;
                    double step = (double) (end - start) / steps;
                    row[o + c] = (byte) Math.round(start + step * k);
                }
                row[o + 3] = (byte) OPAQUE;
            }
            run[k] = row;
        }
        return run;
    }
}
