package org.tesis.loteo;

import org.locationtech.jts.algorithm.MinimumDiameter;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

final class ShapeQuality {

    static final double W_RECTANGULARITY = 0.7;
    static final double W_ASPECT         = 0.3;
    static final double W_REGULARITY     = 0.6;
    static final double W_FRONTAGE       = 0.3;
    static final double CORNER_BONUS     = 10.0;
    static final double FRONTAGE_FULL    = 1.5;   // frente que alcanza puntaje completo, en múltiplos del mínimo

    private ShapeQuality() {
    }

    // lados del rectángulo mínimo rotado: {corto, largo}
    static double[] sides(Polygon p) {
        Geometry mr = new MinimumDiameter(p).getMinimumRectangle();
        Coordinate[] c = mr.getCoordinates();
        if (!(mr instanceof Polygon) || c.length < 4) return new double[]{0.0, p.getLength() / 2};
        double a = c[0].distance(c[1]), b = c[1].distance(c[2]);
        return new double[]{Math.min(a, b), Math.max(a, b)};
    }

    static double rectangularity(Polygon p) {
        double[] s = sides(p);
        double box = s[0] * s[1];
        return box <= 0 ? 0.0 : Math.min(1.0, p.getArea() / box);
    }

    // largo/ancho del rectángulo mínimo, siempre >= 1 (infinito si es degenerado)
    static double aspectRatio(Polygon p) {
        double[] s = sides(p);
        return s[0] <= 0 ? Double.POSITIVE_INFINITY : s[1] / s[0];
    }

    static double aspectScore(double aspect, double lo, double hi) {
        if (Double.isInfinite(aspect) || aspect <= 0) return 0.0;
        if (aspect < lo) return aspect / lo;
        if (aspect > hi) return hi / aspect;
        return 1.0;
    }

    static double regularity(Polygon p, double aspectLo, double aspectHi) {
        return 100.0 * (W_RECTANGULARITY * rectangularity(p)
                + W_ASPECT * aspectScore(aspectRatio(p), aspectLo, aspectHi));
    }

    static double frontageScore(double frontage, double minFrontage) {
        if (minFrontage <= 0) return 100.0;
        return 100.0 * Math.min(1.0, frontage / (FRONTAGE_FULL * minFrontage));
    }

    // 0..100
    static double quality(double regularity, double frontageScore, boolean corner) {
        return W_REGULARITY * regularity + W_FRONTAGE * frontageScore + (corner ? CORNER_BONUS : 0.0);
    }
}
