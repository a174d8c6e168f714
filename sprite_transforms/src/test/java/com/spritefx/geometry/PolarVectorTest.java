package com.spritefx.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Point and PolarVector conversions.
 */
class PolarVectorTest {

    private static final double EPSILON = 1e-9;

    @Test
    @DisplayName("Center rounds down")
    void centerRoundsDown() {
        assertEquals(new Point(2, 1), Point.centerOf(5, 3));
        assertEquals(new Point(2, 2), Point.centerOf(4, 4));
        assertEquals(Point.ORIGIN, Point.centerOf(1, 1));
    }

    @Test
    @DisplayName("between() measures the offset from the center")
    void betweenMeasuresOffset() {
        PolarVector v = PolarVector.between(new Point(2, 2), new Point(5, 6));

        assertEquals(5.0, v.magnitude(), EPSILON);
        assertEquals(Math.atan2(4, 3), v.direction(), EPSILON);
    }

    @Test
    @DisplayName("Zero offset has zero magnitude")
    void zeroOffset() {
        PolarVector v = PolarVector.between(new Point(3, 3), new Point(3, 3));
        assertEquals(0.0, v.magnitude(), EPSILON);
        assertEquals(new Point(3, 3), v.toPoint(new Point(3, 3)));
    }

    @Test
    @DisplayName("Round trip returns the original point")
    void roundTrip() {
        Point center = new Point(4, 4);
        Point point = new Point(1, 7);

        assertEquals(point, PolarVector.between(center, point).toPoint(center));
    }

    @Test
    @DisplayName("Scaled conversion doubles center and length")
    void scaledConversion() {
        Point center = new Point(2, 2);
        Point scaled = PolarVector.between(center, new Point(3, 1)).toPoint(center, 2);

        assertEquals(new Point(6, 2), scaled);
    }

    @Test
    @DisplayName("Positive turn is clockwise on screen")
    void positiveTurnIsClockwise() {
        Point center = new Point(0, 0);
        // Pointing right; a clockwise quarter turn points down (y grows downward).
        Point turned = PolarVector.between(center, new Point(3, 0))
            .turn(Math.PI / 2)
            .toPoint(center);

        assertEquals(new Point(0, 3), turned);
    }
}
