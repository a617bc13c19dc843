package com.pixelmelt.engine.stretch;

import com.pixelmelt.engine.image.Direction;
import com.pixelmelt.engine.image.PixelBuffer;

import java.util.EnumMap;
import java.util.Map;

/**
 * Reduces every {@link Direction} to the canonical downward case by rotating
 * the buffer, and undoes the rotation afterwards. All direction-specific
 * geometry lives here.
 */
public class OrientationNormalizer {

    /**
     * Per-direction rotation strategy.
     */
    public interface Orientation {
        PixelBuffer rotateIn(PixelBuffer buffer);

        /**
         * Maps an already clamped offset in the original frame to a row index in the
         * rotated frame.
         */
        int adjustOffset(int clampedOffset, PixelBuffer rotated);

        PixelBuffer rotateOut(PixelBuffer buffer);
    }

    /**
     * A buffer rotated into the canonical frame plus the start row in that frame.
     */
    public static class CanonicalView {
        private final PixelBuffer buffer;
        private final int startOffset;

        public CanonicalView(PixelBuffer buffer, int startOffset) {
            this.buffer = buffer;
            this.startOffset = startOffset;
        }

        public PixelBuffer getBuffer() {
            return buffer;
        }

        public int getStartOffset() {
            return startOffset;
        }
    }

    private static final Map<Direction, Orientation> ORIENTATIONS = new EnumMap<>(Direction.class);

    static {
        ORIENTATIONS.put(Direction.DOWN, new Orientation() {
            @Override
            public PixelBuffer rotateIn(PixelBuffer buffer) {
                return buffer.copy();
            }

            @Override
            public int adjustOffset(int clampedOffset, PixelBuffer rotated) {
                return clampedOffset;
            }

            @Override
            public PixelBuffer rotateOut(PixelBuffer buffer) {
                return buffer.copy();
            }
        });
        ORIENTATIONS.put(Direction.UP, new Orientation() {
            @Override
            public PixelBuffer rotateIn(PixelBuffer buffer) {
                return rotate(rotate(buffer, true), true);
            }

            @Override
            public int adjustOffset(int clampedOffset, PixelBuffer rotated) {
                return rotated.getHeight() - clampedOffset - 1;
            }

            @Override
            public PixelBuffer rotateOut(PixelBuffer buffer) {
                return rotate(rotate(buffer, true), true);
            }
        });
        ORIENTATIONS.put(Direction.RIGHT, new Orientation() {
            @Override
            public PixelBuffer rotateIn(PixelBuffer buffer) {
                return rotate(buffer, true);
            }

            @Override
            public int adjustOffset(int clampedOffset, PixelBuffer rotated) {
                return rotated.getHeight() - clampedOffset - 1;
            }

            @Override
            public PixelBuffer rotateOut(PixelBuffer buffer) {
                return rotate(buffer, false);
            }
        });
        ORIENTATIONS.put(Direction.LEFT, new Orientation() {
            @Override
            public PixelBuffer rotateIn(PixelBuffer buffer) {
                return rotate(buffer, false);
            }

            @Override
            public int adjustOffset(int clampedOffset, PixelBuffer rotated) {
                return clampedOffset;
            }

            @Override
            public PixelBuffer rotateOut(PixelBuffer buffer) {
                return rotate(buffer, true);
            }
        });
    }

    public static Orientation forDirection(Direction direction) {
        return ORIENTATIONS.get(direction != null ? direction : Direction.DOWN);
    }

    /**
     * Rotates the buffer so the requested direction points down and maps the
     * starting pixel into the rotated frame. The offset is clamped to the
     * direction's axis first.
     */
    public static CanonicalView toCanonical(PixelBuffer buffer, int startingPixel, Direction direction) {
        Direction d = direction != null ? direction : Direction.DOWN;
        int last = Math.max(0, d.axisLength(buffer.getWidth(), buffer.getHeight()) - 1);
        int clamped = Math.max(0, Math.min(startingPixel, last));

        Orientation orientation = forDirection(d);
        PixelBuffer rotated = orientation.rotateIn(buffer);
        return new CanonicalView(rotated, orientation.adjustOffset(clamped, rotated));
    }

    /**
     * Inverse of {@link #toCanonical}: returns the buffer in its original orientation.
     */
    public static PixelBuffer fromCanonical(PixelBuffer buffer, Direction direction) {
        return forDirection(direction).rotateOut(buffer);
    }

    /**
     * Rotates by 90 degrees into a freshly allocated height x width buffer.
     * Clockwise maps (x, y) to (height-1-y, x); counter-clockwise to (y, width-1-x).
     */
    public static PixelBuffer rotate(PixelBuffer buffer, boolean clockwise) {
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        int newWidth = height;
        byte[] src = buffer.getData();
        byte[] dst = new byte[src.length];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int newX;
                int newY;
                if (clockwise) {
                    newX = height - 1 - y;
                    newY = x;
                } else {
                    newX = y;
                    newY = width - 1 - x;
                }
                System.arraycopy(src, (y * width + x) * PixelBuffer.CHANNELS,
                        dst, (newY * newWidth + newX) * PixelBuffer.CHANNELS, PixelBuffer.CHANNELS);
            }
        }
        return new PixelBuffer(dst, newWidth, width);
    }
}
