package com.pixelmelt.engine.stretch;

import com.pixelmelt.engine.image.StretchParams;

import java.util.Arrays;

/**
 * Turns an intensity into the sequence of gradient-run lengths consumed by
 * {@link StretchBuilder}. The result depends on intensity only, never on the
 * image.
 */
public class IndexSequenceGenerator {

    // (value, baseCount) pairs, Fibonacci values
    private static final int[][] BASE_TABLE = {
            { 1, 13 }, { 2, 8 }, { 3, 5 }, { 5, 3 }, { 8, 2 }, { 13, 1 }, { 21, 1 }, { 34, 1 },
            { 55, 1 }, { 89, 1 }, { 144, 1 }, { 233, 1 }, { 377, 1 }, { 610, 1 }, { 987, 1 }
    };

    // indexed by intensity; 13 -> 1.00 down to 1 -> 4.00
    private static final double[] INVERSE_FACTOR = {
            Double.NaN, 4.00, 3.75, 3.50, 3.25, 3.00, 2.75, 2.50, 2.25, 2.00, 1.75, 1.50, 1.25, 1.00
    };

    /**
     * Returns the run-length sequence for an intensity in [1, 13].
     *
     * @throws IllegalArgumentException if intensity is out of range
     */
    public static int[] generate(int intensity) {
        int[] counts = scaledCounts(intensity);

        int total = 0;
        for (int c : counts) {
            total += c;
        }

        int[] sequence = new int[total];
        int idx = 0;
        for (int i = 0; i < BASE_TABLE.length; i++) {
            Arrays.fill(sequence, idx, idx + counts[i], BASE_TABLE[i][0]);
            idx += counts[i];
        }
        return sequence;
    }

    /**
     * Per-entry repetition counts after scaling by the inverse-intensity factor.
     */
    public static int[] scaledCounts(int intensity) {
        if (intensity < StretchParams.MIN_INTENSITY || intensity > StretchParams.MAX_INTENSITY) {
            throw new IllegalArgumentException("Intensity must be in [" + StretchParams.MIN_INTENSITY + ", "
                    + StretchParams.MAX_INTENSITY + "], got " + intensity);
        }
        double factor = INVERSE_FACTOR[intensity];
        int[] counts = new int[BASE_TABLE.length];
        for (int i = 0; i < BASE_TABLE.length; i++) {
            counts[i] = (int) Math.floor(BASE_TABLE[i][1] * factor);
        }
        return counts;
    }

    /**
     * The run-length values in table order, one per base entry.
     */
    static int[] baseValues() {
        int[] values = new int[BASE_TABLE.length];
        for (int i = 0; i < BASE_TABLE.length; i++) {
            values[i] = BASE_TABLE[i][0];
        }
        return values;
    }

    static int[] baseCounts() {
        int[] counts = new int[BASE_TABLE.length];
        for (int i = 0; i < BASE_TABLE.length; i++) {
            counts[i] = BASE_TABLE[i][1];
        }
        return counts;
    }
}
