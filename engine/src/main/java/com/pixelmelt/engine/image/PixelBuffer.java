package com.pixelmelt.engine.image;

import com.pixelmelt.util.RgbaCodec;

import java.util.Arrays;

/**
 * An 8-bit RGBA raster, row-major with the top row first.
 */
public class PixelBuffer {
    public static final int CHANNELS = RgbaCodec.CHANNELS;

    // data.length == width * height * CHANNELS
    private final byte[] data;
    private final int width;
    private final int height;

    public PixelBuffer(byte[] data, int width, int height) {
        if (data == null) {
            throw new IllegalArgumentException("Pixel data must not be null");
        }
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative dimensions " + width + "x" + height);
        }
        int expected = byteLength(width, height);
        if (data.length != expected) {
            throw new IllegalArgumentException(
                    "Pixel data length " + data.length + " does not match " + width + "x" + height + "x" + CHANNELS);
        }
        this.data = data;
        this.width = width;
        this.height = height;
    }

    /**
     * Allocates a zeroed buffer. Throws ArithmeticException if the size does not fit in an int.
     */
    public static PixelBuffer allocate(int width, int height) {
        return new PixelBuffer(new byte[byteLength(width, height)], width, height);
    }

    public static PixelBuffer filled(int width, int height, int r, int g, int b, int a) {
        PixelBuffer buffer = allocate(width, height);
        byte[] d = buffer.data;
        for (int i = 0; i < d.length; i += CHANNELS) {
            d[i] = (byte) r;
            d[i + 1] = (byte) g;
            d[i + 2] = (byte) b;
            d[i + 3] = (byte) a;
        }
        return buffer;
    }

    /**
     * Builds a buffer from packed 0xRRGGBBAA rows, rows[y][x].
     */
    public static PixelBuffer fromRows(int[][] rows) {
        int height = rows.length;
        int width = height == 0 ? 0 : rows[0].length;
        PixelBuffer buffer = allocate(width, height);
        for (int y = 0; y < height; y++) {
            if (rows[y].length != width) {
                throw new IllegalArgumentException("Row " + y + " has " + rows[y].length + " pixels, expected " + width);
            }
            System.arraycopy(RgbaCodec.toBytes(rows[y]), 0, buffer.data, y * buffer.rowStride(), buffer.rowStride());
        }
        return buffer;
    }

    public static int byteLength(int width, int height) {
        return Math.multiplyExact(Math.multiplyExact(width, height), CHANNELS);
    }

    public byte[] getData() {
        return data;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int rowStride() {
        return width * CHANNELS;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    /**
     * Returns a copy of row y.
     */
    public byte[] row(int y) {
        if (y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Row " + y + " outside [0, " + height + ")");
        }
        int stride = rowStride();
        return Arrays.copyOfRange(data, y * stride, (y + 1) * stride);
    }

    /**
     * Returns pixel (x, y) packed as 0xRRGGBBAA.
     */
    public int pixel(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Pixel (" + x + "," + y + ") outside " + width + "x" + height);
        }
        int o = (y * width + x) * CHANNELS;
        return RgbaCodec.pack(data[o], data[o + 1], data[o + 2], data[o + 3]);
    }

    public PixelBuffer copy() {
        return new PixelBuffer(data.clone(), width, height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PixelBuffer)) {
            return false;
        }
        PixelBuffer other = (PixelBuffer) o;
        return width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "PixelBuffer{" + width + "x" + height + "}";
    }
}
