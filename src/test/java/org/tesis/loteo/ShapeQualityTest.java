package org.tesis.loteo;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Polygon;

import static org.junit.jupiter.api.Assertions.*;

class ShapeQualityTest {

    @Test
    void testRectangle() {
        Polygon p = Sites.rect(0, 0, 20, 40);
        double[] s = ShapeQuality.sides(p);
        assertEquals(20.0, s[0], 1e-9);
        assertEquals(40.0, s[1], 1e-9);
        assertEquals(1.0, ShapeQuality.rectangularity(p), 1e-9);
        assertEquals(2.0, ShapeQuality.aspectRatio(p), 1e-9);
        assertEquals(100.0, ShapeQuality.regularity(p, 1.5, 2.0 + 1e-9), 1e-6);
    }

    @Test
    void testRotatedRectangleIsStillRegular() {
        Polygon p = Sites.polygon(0, 0, 30, 30, 10, 50, -20, 20);
        assertEquals(1.0, ShapeQuality.rectangularity(p), 1e-9);
        assertEquals(Math.hypot(30, 30) / Math.hypot(20, 20), ShapeQuality.aspectRatio(p), 1e-9);
    }

    @Test
    void testTriangle() {
        Polygon p = Sites.polygon(0, 0, 10, 0, 0, 10);
        assertEquals(0.5, ShapeQuality.rectangularity(p), 1e-9);
        assertTrue(ShapeQuality.regularity(p, 1.5, 2.0) < 70);
    }

    @Test
    void testScores() {
        assertEquals(1.0, ShapeQuality.aspectScore(1.8, 1.5, 2.0));
        assertEquals(2.0 / 3.0, ShapeQuality.aspectScore(1.0, 1.5, 2.0), 1e-12);
        assertEquals(2.0 / 3.0, ShapeQuality.aspectScore(3.0, 1.5, 2.0), 1e-12);
        assertEquals(0.0, ShapeQuality.aspectScore(Double.POSITIVE_INFINITY, 1.5, 2.0));

        assertEquals(100.0, ShapeQuality.frontageScore(30, 20), 1e-12);
        assertEquals(50.0, ShapeQuality.frontageScore(15, 20), 1e-12);
        assertEquals(100.0, ShapeQuality.frontageScore(0, 0));

        assertEquals(100.0, ShapeQuality.quality(100, 100, true), 1e-12);
        assertEquals(90.0, ShapeQuality.quality(100, 100, false), 1e-12);
    }
}
