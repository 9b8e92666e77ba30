package org.tesis.loteo;

import org.locationtech.jts.geom.Polygon;

public final class Lot {

    private final int id;
    private final Polygon polygon;
    private final double area;
    private final double frontage;
    private final double aspectRatio;
    private final boolean corner;
    private final ZoneType zone;
    private final double quality;

    Lot(int id, Polygon polygon, double frontage, double aspectRatio, boolean corner, ZoneType zone, double quality) {
        this.id = id;
        this.polygon = polygon;
        this.area = polygon.getArea();
        this.frontage = frontage;
        this.aspectRatio = aspectRatio;
        this.corner = corner;
        this.zone = zone;
        this.quality = quality;
    }

    public int id()              { return id; }
    public Polygon polygon()     { return (Polygon) polygon.copy(); }
    Polygon shared()             { return polygon; }
    public double area()         { return area; }
    public double frontage()     { return frontage; }
    public double aspectRatio()  { return aspectRatio; }
    public boolean isCorner()    { return corner; }
    public ZoneType zone()       { return zone; }

    // puntaje 0..100 de regularidad, frente y esquina
    public double quality()      { return quality; }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "Lot#%d{area=%.1f, frente=%.1f, aspecto=%.2f, esquina=%s, %s, q=%.1f}",
                id, area, frontage, aspectRatio, corner, zone, quality);
    }
}
