package com.pixelmelt.engine.image;

/**
 * Caller-supplied stretch parameters. Values are stored as given; range
 * clamping happens in the stretcher.
 */
public class StretchParams {
    public static final int MIN_INTENSITY = 1;
    public static final int MAX_INTENSITY = 13;

    private final int intensity;
    private final int startingPixel;
    private final Direction direction;

    public StretchParams(int intensity, int startingPixel, Direction direction) {
        this.intensity = intensity;
        this.startingPixel = startingPixel;
        this.direction = direction;
    }

    public int getIntensity() {
        return intensity;
    }

    public int getStartingPixel() {
        return startingPixel;
    }

    public Direction getDirection() {
        return direction;
    }

    /**
     * Highest valid starting pixel for the given direction: the last row for
     * UP/DOWN, the last column for LEFT/RIGHT.
     */
    public static int maxStartingPixel(int width, int height, Direction direction) {
        Direction d = direction != null ? direction : Direction.DOWN;
        return Math.max(0, d.axisLength(width, height) - 1);
    }

    public static int clampStartingPixel(int startingPixel, int width, int height, Direction direction) {
        return Math.max(0, Math.min(startingPixel, maxStartingPixel(width, height, direction)));
    }

    public static int clampIntensity(int intensity) {
        return Math.max(MIN_INTENSITY, Math.min(intensity, MAX_INTENSITY));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StretchParams)) {
            return false;
        }
        StretchParams other = (StretchParams) o;
        return intensity == other.intensity && startingPixel == other.startingPixel && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * intensity + startingPixel) + (direction != null ? direction.hashCode() : 0);
    }

    @Override
    public String toString() {
        return "StretchParams{intensity=" + intensity + ", startingPixel=" + startingPixel + ", direction="
                + direction + "}";
    }
}
