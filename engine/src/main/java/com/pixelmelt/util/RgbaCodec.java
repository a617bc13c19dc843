package com.pixelmelt.util;

public class RgbaCodec {

    public static final int CHANNELS = 4;

    /**
     * Packs four 8-bit channels into one int as 0xRRGGBBAA.
     */
    public static int pack(int r, int g, int b, int a) {
        return ((r & 0xFF) << 24) | ((g & 0xFF) << 16) | ((b & 0xFF) << 8) | (a & 0xFF);
    }

    public static int red(int rgba) {
        return (rgba >>> 24) & 0xFF;
    }

    public static int green(int rgba) {
        return (rgba >>> 16) & 0xFF;
    }

    public static int blue(int rgba) {
        return (rgba >>> 8) & 0xFF;
    }

    public static int alpha(int rgba) {
        return rgba & 0xFF;
    }

    public static byte[] toBytes(int[] pixels) {
        if (pixels == null) {
            return null;
        }
        byte[] bytes = new byte[Math.multiplyExact(pixels.length, CHANNELS)];
        for (int i = 0; i < pixels.length; i++) {
            int p = pixels[i];
            int o = i * CHANNELS;
            bytes[o] = (byte) red(p);
            bytes[o + 1] = (byte) green(p);
            bytes[o + 2] = (byte) blue(p);
            bytes[o + 3] = (byte) alpha(p);
        }
        return bytes;
    }
}
