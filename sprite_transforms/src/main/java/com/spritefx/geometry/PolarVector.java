package com.spritefx.geometry;

import org.joml.Vector2d;

/**
 * Immutable polar offset from a center: a length and a direction in radians.
 *
 * <p>Directions follow screen coordinates (y grows downward), so a growing
 * direction turns clockwise on screen.
 */
public record PolarVector(double magnitude, double direction) {

    /**
     * Polar form of {@code point}'s offset from {@code center}.
     */
    public static PolarVector between(Point center, Point point) {
        Vector2d offset = new Vector2d(point.x() - center.x(), point.y() - center.y());
        return new PolarVector(offset.length(), Math.atan2(offset.y, offset.x));
    }

    /**
     * Same length, direction turned by {@code radians}. Positive values turn
     * clockwise on screen.
     */
    public PolarVector turn(double radians) {
        return new PolarVector(magnitude, direction + radians);
    }

    /**
     * Back to a pixel coordinate around {@code center}, with both the center
     * and this vector's length multiplied by {@code scale}. Rounds to the
     * nearest pixel.
     */
    public Point toPoint(Point center, int scale) {
        Vector2d target = new Vector2d(Math.cos(direction), Math.sin(direction))
            .mul(magnitude * scale)
            .add(center.x() * scale, center.y() * scale);
        return new Point((int) Math.round(target.x), (int) Math.round(target.y));
    }

    /**
     * Back to a pixel coordinate around {@code center} at the same scale.
     */
    public Point toPoint(Point center) {
        return toPoint(center, 1);
    }
}
