package com.pixelmelt.engine.image;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Direction in which the stretch runs across the image. DOWN is the canonical
 * case; the others are reduced to it by rotation.
 */
public enum Direction {
    UP,
    DOWN,
    LEFT,
    RIGHT;

    private static final Logger logger = LoggerFactory.getLogger(Direction.class);

    /**
     * True when the starting pixel indexes a row (UP/DOWN) rather than a column.
     */
    public boolean isVertical() {
        return this == UP || this == DOWN;
    }

    /**
     * Length of the axis the starting pixel indexes into.
     */
    public int axisLength(int width, int height) {
        return isVertical() ? height : width;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Direction fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            logger.warn("Direction not specified, defaulting to 'down'");
            return DOWN;
        }

        switch (value.trim().toLowerCase()) {
            case "up":
                return UP;
            case "down":
                return DOWN;
            case "left":
                return LEFT;
            case "right":
                return RIGHT;
            default:
                logger.warn("Unknown direction '{}', defaulting to 'down'", value);
                return DOWN;
        }
    }
}
