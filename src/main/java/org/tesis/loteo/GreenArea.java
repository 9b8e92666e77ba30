package org.tesis.loteo;

import org.locationtech.jts.geom.Polygon;

// BUFFER = franja perimetral, FRAGMENT = recortes sin lote, PARK = lotes cedidos al mínimo verde
public final class GreenArea {

    public enum Kind { BUFFER, FRAGMENT, PARK }

    private final Kind kind;
    private final Polygon polygon;
    private final double area;

    GreenArea(Kind kind, Polygon polygon) {
        this.kind = kind;
        this.polygon = polygon;
        this.area = polygon.getArea();
    }

    public Kind kind()          { return kind; }
    public Polygon polygon()    { return (Polygon) polygon.copy(); }
    Polygon shared()            { return polygon; }
    public double area()        { return area; }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "Green{%s, area=%.1f}", kind, area);
    }
}
