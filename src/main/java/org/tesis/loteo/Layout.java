package org.tesis.loteo;

import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.List;

public final class Layout {

    private final Genome genome;
    private final Boundary boundary;
    private final List<Lot> lots;
    private final List<Road> roads;
    private final RoadNetwork network;
    private final List<GreenArea> greens;
    private Geometry remainder;

    Layout(Genome genome, Boundary boundary, List<Lot> lots, List<Road> roads,
           RoadNetwork network, List<GreenArea> greens) {
        this.genome = genome;
        this.boundary = boundary;
        this.lots = List.copyOf(lots);
        this.roads = List.copyOf(roads);
        this.network = network;
        this.greens = List.copyOf(greens);
    }

    public Genome genome()              { return genome; }
    public Boundary boundary()          { return boundary; }
    public List<Lot> lots()             { return lots; }
    public List<Road> roads()           { return roads; }
    public RoadNetwork network()        { return network; }
    public List<GreenArea> greens()     { return greens; }
    public int lotCount()               { return lots.size(); }

    public double sellableArea() {
        double a = 0;
        for (Lot l : lots) a += l.area();
        return a;
    }

    public double roadArea() {
        double a = 0;
        for (Road r : roads) a += r.area();
        return a;
    }

    public double totalRoadLength() {
        double s = 0;
        for (Road r : roads) s += r.length();
        return s;
    }

    public double greenArea() {
        double a = 0;
        for (GreenArea g : greens) a += g.area();
        return a;
    }

    public double greenArea(GreenArea.Kind kind) {
        double a = 0;
        for (GreenArea g : greens) if (g.kind() == kind) a += g.area();
        return a;
    }

    public double greenRatio() {
        return greenArea() / boundary.area();
    }

    public double meanQuality() {
        if (lots.isEmpty()) return 0.0;
        double s = 0;
        for (Lot l : lots) s += l.quality();
        return s / lots.size();
    }

    // límite menos todo lo asignado; se calcula una sola vez y a pedido
    public synchronized Geometry remainder() {
        if (remainder == null) {
            List<Geometry> used = new ArrayList<>();
            for (Lot l : lots) used.add(l.shared());
            for (Road r : roads) used.add(r.sharedFootprint());
            for (GreenArea g : greens) used.add(g.shared());
            Geometry u = GeomUtils.union(used, boundary.shared().getFactory());
            remainder = GeomUtils.difference(boundary.shared(), u);
        }
        return remainder.copy();
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "Layout{lotes=%d, vias=%d, verde=%.1f%%, %s}",
                lots.size(), roads.size(), 100.0 * greenRatio(), genome);
    }
}
