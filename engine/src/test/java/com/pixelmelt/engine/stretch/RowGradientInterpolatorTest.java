package com.pixelmelt.engine.stretch;

import com.pixelmelt.util.RgbaCodec;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class RowGradientInterpolatorTest {

    @Test
    public void testZeroGradientReturnsEndpoints() {
        byte[] a = RgbaCodec.toBytes(new int[] { RgbaCodec.pack(10, 20, 30, 40), RgbaCodec.pack(1, 2, 3, 4) });
        byte[] b = RgbaCodec.toBytes(new int[] { RgbaCodec.pack(50, 60, 70, 80), RgbaCodec.pack(5, 6, 7, 8) });

        byte[][] run = RowGradientInterpolator.interpolate(a, b, 0, 2);
        assertEquals(2, run.length);
        assertArrayEquals(a, run[0]);
        assertArrayEquals(b, run[1]);
    }

    @Test
    public void testLinearBlendIsRoundedAndOpaque() {
        byte[] a = RgbaCodec.toBytes(new int[] { RgbaCodec.pack(0, 0, 0, 0) });
        byte[] b = RgbaCodec.toBytes(new int[] { RgbaCodec.pack(255, 255, 255, 0) });

        byte[][] run = RowGradientInterpolator.interpolate(a, b, 3, 1);
        assertEquals(5, run.length);
        // step 63.75
        assertArrayEquals(RgbaCodec.toBytes(new int[] { RgbaCodec.pack(64, 64, 64, 255) }), run[1]);
        assertArrayEquals(RgbaCodec.toBytes(new int[] { RgbaCodec.pack(128, 128, 128, 255) }), run[2]);
        assertArrayEquals(RgbaCodec.toBytes(new int[] { RgbaCodec.pack(191, 191, 191, 255) }), run[3]);
        // endpoints keep their own alpha
        assertEquals(0, run[0][3]);
        assertEquals(0, run[4][3]);
    }

    @Test
    public void testChannelsBlendIndependently() {
        byte[] a = RgbaCodec.toBytes(new int[] { RgbaCodec.pack(255, 0, 90, 255) });
        byte[] b = RgbaCodec.toBytes(new int[] { RgbaCodec.pack(0, 255, 0, 255) });

        byte[][] run = RowGradientInterpolator.interpolate(a, b, 2, 1);
        assertArrayEquals(RgbaCodec.toBytes(new int[] { RgbaCodec.pack(170, 85, 60, 255) }), run[1]);
        assertArrayEquals(RgbaCodec.toBytes(new int[] { RgbaCodec.pack(85, 170, 30, 255) }), run[2]);
    }

    @Test
    public void testIdenticalRowsStayUnchanged() {
        byte[] a = RgbaCodec.toBytes(new int[] { RgbaCodec.pack(12, 200, 77, 255), RgbaCodec.pack(3, 3, 3, 255) });

        byte[][] run = RowGradientInterpolator.interpolate(a, a.clone(), 5, 2);
        assertEquals(7, run.length);
        for (byte[] row : run) {
            assertArrayEquals(a, row);
        }
    }

    @Test
    public void testRunRowsAreFreshArrays() {
        byte[] a = new byte[4];
        byte[] b = new byte[4];
        byte[][] run = RowGradientInterpolator.interpolate(a, b, 0, 1);
        assertNotSame(a, run[0]);
        assertNotSame(b, run[1]);
    }

    @Test
    public void testRejectsBadArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> RowGradientInterpolator.interpolate(new byte[4], new byte[8], 1, 1));
        assertThrows(IllegalArgumentException.class,
                () -> RowGradientInterpolator.interpolate(new byte[4], new byte[4], -1, 1));
    }
}
