package org.tesis.loteo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

// plano inclinado z = z0 + gx*x + gy*y; cada lote se nivela a su cota media
public class PlanarTerrainModel implements TerrainOracle {

    static final double GRID_STEP          = 5.0;
    static final double DEFAULT_MAX_SLOPE  = 15.0;    // %
    static final double DEFAULT_COST_M3    = 3.0;

    private final double z0, gx, gy;
    private final double maxSlopePercent;
    private final double costPerVolume;

    public PlanarTerrainModel(double z0, double gx, double gy) {
        this(z0, gx, gy, DEFAULT_MAX_SLOPE, DEFAULT_COST_M3);
    }

    public PlanarTerrainModel(double z0, double gx, double gy, double maxSlopePercent, double costPerVolume) {
        this.z0 = z0;
        this.gx = gx;
        this.gy = gy;
        this.maxSlopePercent = maxSlopePercent;
        this.costPerVolume = costPerVolume;
    }

    public double elevation(double x, double y) {
        return z0 + gx * x + gy * y;
    }

    public double slopePercent() {
        return 100.0 * Math.hypot(gx, gy);
    }

    @Override
    public TerrainScore score(Layout layout) {
        double volume = 0;
        for (Lot l : layout.lots()) volume += earthwork(l.shared());
        int violations = 0;
        double maxSlope = 0;
        if (!layout.lots().isEmpty()) {
            maxSlope = slopePercent();
            if (maxSlope > maxSlopePercent) violations = layout.lotCount();
        }
        return new TerrainScore(volume * costPerVolume, violations, maxSlope);
    }

    // volumen |z - cota media| sobre las celdas cuyo centro cae dentro del lote
    double earthwork(Polygon lot) {
        Envelope e = lot.getEnvelopeInternal();
        PreparedGeometry prep = PreparedGeometryFactory.prepare(lot);
        int nx = Math.max(1, (int) Math.ceil(e.getWidth() / GRID_STEP));
        int ny = Math.max(1, (int) Math.ceil(e.getHeight() / GRID_STEP));
        double cw = e.getWidth() / nx, ch = e.getHeight() / ny;
        double sum = 0; int n = 0;
        double[] zs = new double[nx * ny];
        for (int i=0;i<nx;i++) {
            for (int j=0;j<ny;j++) {
                double x = e.getMinX() + (i + 0.5) * cw, y = e.getMinY() + (j + 0.5) * ch;
                if (!prep.contains(lot.getFactory().createPoint(new Coordinate(x, y)))) continue;
                zs[n++] = elevation(x, y);
                sum += zs[n-1];
            }
        }
        if (n == 0) return 0.0;
        double mean = sum / n, dev = 0;
        for (int k=0;k<n;k++) dev += Math.abs(zs[k] - mean);
        // cada muestra representa su parte del área real del lote
        return dev * lot.getArea() / n;
    }
}
