package com.spritefx.rotation;

/**
 * Degree handling for sprite rotation.
 *
 * Every integer is a valid angle: values are wrapped into [0, 360) rather
 * than rejected.
 */
public final class Angles {

    private Angles() {
        // Utility class
    }

    public static final int FULL_TURN = 360;

    /**
     * Wrap an angle into [0, 360) using floored modulo, so -90 becomes 270.
     */
    public static int normalize(int degrees) {
        return Math.floorMod(degrees, FULL_TURN);
    }

    /**
     * Check whether an angle is a multiple of 90 degrees.
     */
    public static boolean isRightAngle(int degrees) {
        return normalize(degrees) % 90 == 0;
    }

    /**
     * Convert degrees to radians.
     */
    public static double toRadians(int degrees) {
        return Math.PI * degrees / 180.0;
    }

    /**
     * Add two angles without overflowing; the sum is kept congruent mod 360.
     */
    public static int add(int degrees, int delta) {
        long sum = (long) degrees + delta;
        if (sum > Integer.MAX_VALUE || sum < Integer.MIN_VALUE) {
            return normalize(degrees) + normalize(delta);
        }
        return (int) sum;
    }
}
