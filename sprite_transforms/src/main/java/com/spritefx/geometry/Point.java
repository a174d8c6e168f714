package com.spritefx.geometry;

/**
 * Immutable integer pixel coordinate.
 */
public record Point(int x, int y) {

    /** The origin. */
    public static final Point ORIGIN = new Point(0, 0);

    /**
     * Center of a {@code width x height} grid, rounded down.
     */
    public static Point centerOf(int width, int height) {
        return new Point(width >> 1, height >> 1);
    }
}
