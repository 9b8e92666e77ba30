package org.tesis.loteo;

import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;

import java.util.List;
import java.util.Objects;

// límite, restricciones y, opcionales, zonas excluidas, zonas preferentes y guías de vías
public final class SiteInput {

    private final Boundary boundary;
    private final ConstraintSet constraints;
    private final List<Polygon> exclusionZones;
    private final List<Polygon> preferredZones;
    private final List<LineString> roadGuides;

    public SiteInput(Boundary boundary, ConstraintSet constraints,
                     List<Polygon> exclusionZones, List<Polygon> preferredZones, List<LineString> roadGuides) {
        this.boundary = Objects.requireNonNull(boundary, "boundary");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
        this.exclusionZones = List.copyOf(exclusionZones);
        this.preferredZones = List.copyOf(preferredZones);
        this.roadGuides = List.copyOf(roadGuides);
    }

    public static SiteInput of(Boundary boundary, ConstraintSet constraints) {
        return new SiteInput(boundary, constraints, List.of(), List.of(), List.of());
    }

    public SiteInput withRoadGuides(List<LineString> guides) {
        return new SiteInput(boundary, constraints, exclusionZones, preferredZones, guides);
    }

    public SiteInput withExclusionZones(List<Polygon> zones) {
        return new SiteInput(boundary, constraints, zones, preferredZones, roadGuides);
    }

    public SiteInput withPreferredZones(List<Polygon> zones) {
        return new SiteInput(boundary, constraints, exclusionZones, zones, roadGuides);
    }

    public Boundary boundary()                 { return boundary; }
    public ConstraintSet constraints()         { return constraints; }
    public List<Polygon> exclusionZones()      { return exclusionZones; }
    public List<Polygon> preferredZones()      { return preferredZones; }
    public List<LineString> roadGuides()       { return roadGuides; }
}
