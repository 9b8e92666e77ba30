package org.tesis.loteo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.valid.IsSimpleOp;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;

public final class Boundary {

    private final Polygon polygon;
    private final double area;

    private Boundary(Polygon polygon) {
        this.polygon = polygon;
        this.area = polygon.getArea();
    }

    // valida y envuelve; cualquier degeneración termina en InvalidBoundaryException
    public static Boundary of(Polygon polygon) {
        if (polygon == null || polygon.isEmpty()) {
            throw new InvalidBoundaryException("Límite vacío");
        }
        if (!new IsSimpleOp(polygon.getExteriorRing()).isSimple()) {
            Coordinate at = new IsSimpleOp(polygon.getExteriorRing()).getNonSimpleLocation();
            throw new InvalidBoundaryException("Límite con auto-intersección en " + at);
        }
        IsValidOp valid = new IsValidOp(polygon);
        if (!valid.isValid()) {
            TopologyValidationError err = valid.getValidationError();
            throw new InvalidBoundaryException("Límite inválido: " + err.getMessage() + " en " + err.getCoordinate());
        }
        if (!(polygon.getArea() > 0)) {
            throw new InvalidBoundaryException("Límite con área nula o negativa");
        }
        return new Boundary((Polygon) polygon.copy());
    }

    public Polygon polygon() {
        return (Polygon) polygon.copy();
    }

    // acceso sin copia para el decodificador; no se debe mutar
    Polygon shared() {
        return polygon;
    }

    public double area() {
        return area;
    }

    @Override
    public String toString() {
        return "Boundary{area=" + area + ", vertices=" + polygon.getNumPoints() + "}";
    }
}
