package org.tesis.loteo;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;

public final class Road {

    private final int id;
    private final LineString centerline;
    private final double width;
    private final RoadClass roadClass;
    private final Geometry footprint;

    Road(int id, LineString centerline, double width, RoadClass roadClass, Geometry footprint) {
        this.id = id;
        this.centerline = centerline;
        this.width = width;
        this.roadClass = roadClass;
        this.footprint = footprint;
    }

    public int id()                 { return id; }
    public LineString centerline()  { return (LineString) centerline.copy(); }
    public double width()           { return width; }
    public RoadClass roadClass()    { return roadClass; }
    public Geometry footprint()     { return footprint.copy(); }
    Geometry sharedFootprint()      { return footprint; }
    public double length()          { return centerline.getLength(); }
    public double area()            { return footprint.getArea(); }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "Road#%d{%s, ancho=%.1f, largo=%.1f}", id, roadClass, width, length());
    }
}
