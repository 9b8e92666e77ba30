package org.tesis.loteo;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.linearref.LengthIndexedLine;
import org.locationtech.jts.operation.buffer.BufferOp;
import org.locationtech.jts.operation.buffer.BufferParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Decodificador determinista genoma -> layout. Trabaja en un marco local donde la vía principal
 * es horizontal; las vías secundarias cortan el eje principal en manzanas y cada mitad de manzana
 * se llena con franjas de lotes. Al final todo vuelve al marco del predio.
 *
 * Nunca lanza para un genoma reparado: los sitios degenerados dan un layout sin lotes.
 */
public class LayoutDecoder {

    private static final Logger log = LoggerFactory.getLogger(LayoutDecoder.class);

    // mapeo de genes
    static final double ANGLE_DEAD_BAND     = 0.1;
    static final double ANGLE_MAX_OFFSET    = Math.PI / 4;
    static final double PRIMARY_POS_MIN     = 0.3;
    static final double PRIMARY_POS_SPAN    = 0.4;
    static final double LOT_WIDTH_SPAN      = 1.8;
    static final double LOCAL_ROADS_ON      = 0.5;
    static final double GREEN_CAP_MAX       = 60.0;
    static final double ZONE_MIX_SPAN       = 2.0;

    // geometría
    static final int    QUADRANT_SEGMENTS   = 8;
    static final double ARC_FACTOR          = 1.0 / Math.cos(Math.PI / (4 * QUADRANT_SEGMENTS));
    static final double EDGE_PROBE          = 1e-4;
    static final int    MAX_SPLIT_DEPTH     = 16;
    static final double LAST_STRIP_MIN      = 0.5;   // fondo mínimo (fracción) de la franja tras una vía local
    static final double CORNER_SIDE_MIN     = 0.5;   // contacto lateral mínimo (fracción del frente mínimo)

    private final DecoderSettings settings;

    public LayoutDecoder() {
        this(DecoderSettings.defaults());
    }

    public LayoutDecoder(DecoderSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public DecoderSettings settings() {
        return settings;
    }

    public Layout decode(Genome genome, Boundary boundary, ConstraintSet constraints) {
        return decode(genome, SiteInput.of(boundary, constraints));
    }

    public Layout decode(Genome genome, SiteInput site) {
        Genome g = GenomeRepair.repair(genome);
        Dims d = dims(g, site.constraints(), settings);
        try {
            return new Pass(g, site, d).run();
        } catch (TopologyException e) {
            log.warn("Decodificación degenerada por error topológico: {} | {}", e.getMessage(), g);
            return new Layout(g, site.boundary(), List.of(), List.of(), RoadNetwork.empty(), List.of());
        }
    }

    // ------------- dimensiones resueltas -------------

    /** Medidas efectivas: restricciones del sitio, valores por defecto y genes combinados. */
    static final class Dims {
        double minArea, maxArea, minFrontage, aspectLo, aspectHi;
        double buffer, roadW, primaryW, greenRatio;
        double lotW, aspect, lotL;
        double minBlock, maxBlock;
        double greenCap, factoryArea;
        boolean localRoads;
        double angleOffset, primaryPos;
    }

    static Dims dims(Genome g, ConstraintSet cs, DecoderSettings s) {
        Dims d = new Dims();
        d.minArea     = Math.max(cs.lowerBound(ConstraintSet.MIN_LOT_SIZE, s.minLotSize()), GeomUtils.AREA_EPS);
        d.maxArea     = cs.upperBound(ConstraintSet.MAX_LOT_SIZE, Double.POSITIVE_INFINITY);
        d.minFrontage = Math.max(cs.lowerBound(ConstraintSet.MIN_FRONTAGE, s.minFrontage()), 0.0);
        d.aspectLo    = Math.max(1.0, cs.lowerBound(ConstraintSet.LOT_ASPECT_RATIO, s.aspectMin()));
        d.aspectHi    = Math.max(d.aspectLo, cs.upperBound(ConstraintSet.LOT_ASPECT_RATIO, s.aspectMax()));
        d.buffer      = Math.max(cs.lowerBound(ConstraintSet.BUFFER_WIDTH, s.bufferWidth()), 0.0);
        d.roadW       = Math.max(cs.lowerBound(ConstraintSet.ROAD_WIDTH, s.roadWidth()), EDGE_PROBE * 10);
        d.primaryW    = Math.max(cs.lowerBound(ConstraintSet.PRIMARY_ROAD_WIDTH, s.primaryRoadWidth()), d.roadW);
        d.greenRatio  = Math.max(cs.lowerBound(ConstraintSet.GREEN_SPACE_RATIO, 0.0), 0.0);

        // lote: el frente mínimo debe admitir el área mínima dentro del rango de proporción
        double wMin = Math.max(d.minFrontage, Math.sqrt(d.minArea / d.aspectHi));
        d.lotW   = lerp(wMin, LOT_WIDTH_SPAN * wMin, g.gene(Genome.LOT_WIDTH));
        d.aspect = lerp(d.aspectLo, d.aspectHi, g.gene(Genome.LOT_ASPECT));
        d.lotL   = Math.max(d.lotW * d.aspect, d.minArea / d.lotW);
        if (d.lotW * d.lotL > d.maxArea) {
            d.lotW = Math.max(d.minFrontage, Math.min(d.lotW, Math.sqrt(d.maxArea / d.aspect)));
            d.lotL = Math.min(d.lotW * d.aspect, d.maxArea / d.lotW);
        }

        d.minBlock = Math.max(s.minBlockLength(), 2 * d.lotW);
        double lo = 2 * d.minBlock + d.roadW;
        d.maxBlock = lerp(lo, Math.max(s.maxBlockLength(), lo), g.gene(Genome.BLOCK_SPACING));

        d.localRoads  = g.gene(Genome.LOCAL_ROADS) >= LOCAL_ROADS_ON;
        d.greenCap    = GREEN_CAP_MAX * g.gene(Genome.GREEN_CAP);
        d.factoryArea = d.minArea * (1.0 + ZONE_MIX_SPAN * g.gene(Genome.ZONE_MIX));
        d.angleOffset = angleOffset(g.gene(Genome.PRIMARY_ANGLE));
        d.primaryPos  = PRIMARY_POS_MIN + PRIMARY_POS_SPAN * g.gene(Genome.PRIMARY_OFFSET);
        return d;
    }

    // banda muerta en torno a 0.5 = sin giro; fuera de ella crece lineal hasta +-45°
    static double angleOffset(double gene) {
        double t = gene - 0.5;
        if (Math.abs(t) < ANGLE_DEAD_BAND) return 0.0;
        return Math.signum(t) * (Math.abs(t) - ANGLE_DEAD_BAND) / (0.5 - ANGLE_DEAD_BAND) * ANGLE_MAX_OFFSET;
    }

    static double lerp(double a, double b, double t) {
        return a + (b - a) * t;
    }

    // ------------- una decodificación -------------

    private static final class Pass {
        final Genome genome;
        final SiteInput site;
        final Dims d;
        final GeometryFactory gf;
        final Polygon boundary;

        AffineTransformation toWorld;
        Geometry localDev;
        Envelope env;

        final List<LotDraft> drafts = new ArrayList<>();
        final List<RoadDraft> roads = new ArrayList<>();
        final List<Polygon> fragments = new ArrayList<>();
        final List<Polygon> bufferGreens = new ArrayList<>();
        final List<Coordinate> junctions = new ArrayList<>();

        Pass(Genome genome, SiteInput site, Dims d) {
            this.genome = genome;
            this.site = site;
            this.d = d;
            this.boundary = site.boundary().shared();
            this.gf = boundary.getFactory();
        }

        Layout run() {
            // 1. franja perimetral y área desarrollable
            Geometry dev = boundary;
            if (d.buffer > 0) {
                BufferParameters bp = new BufferParameters(QUADRANT_SEGMENTS);
                bp.setSimplifyFactor(0.0);
                dev = BufferOp.bufferOp(boundary, -d.buffer * ARC_FACTOR, bp);
                for (Polygon p : GeomUtils.polygons(GeomUtils.difference(boundary, dev))) {
                    if (p.getArea() > GeomUtils.AREA_EPS) bufferGreens.add(p);
                }
            }
            if (!site.exclusionZones().isEmpty() && !dev.isEmpty()) {
                dev = GeomUtils.difference(dev, GeomUtils.union(site.exclusionZones(), gf));
            }
            if (dev.isEmpty() || dev.getArea() < GeomUtils.AREA_EPS) {
                log.debug("Sin área desarrollable tras la franja perimetral: {}", genome);
                return finish();
            }

            // 2. marco local
            Envelope be = boundary.getEnvelopeInternal();
            double cx = be.centre().x, cy = be.centre().y;
            LineString guide = site.roadGuides().isEmpty() ? null : site.roadGuides().get(0);
            double angle = guide != null
                    ? GeomUtils.lineAngle(guide)
                    : GeomUtils.normalizeAxis(GeomUtils.longAxisAngle(dev) + d.angleOffset);
            AffineTransformation toLocal = GeomUtils.rotation(-angle, cx, cy);
            toWorld = GeomUtils.rotation(angle, cx, cy);
            localDev = toLocal.transform(dev);
            env = localDev.getEnvelopeInternal();

            // 3. vía principal
            double half = d.primaryW / 2;
            if (env.getHeight() < d.primaryW) {
                log.debug("Sin espacio para la vía principal (alto {} < {})", env.getHeight(), d.primaryW);
                return finish();
            }
            double yc = env.getMinY() + env.getHeight() * d.primaryPos;
            if (guide != null) {
                Coordinate mid = new LengthIndexedLine(guide).extractPoint(guide.getLength() / 2);
                Coordinate m = new Coordinate();
                toLocal.transform(mid, m);
                yc = m.y;
            }
            yc = Math.max(env.getMinY() + half, Math.min(env.getMaxY() - half, yc));

            List<Geometry> primaryFeet = new ArrayList<>();
            List<LineString> primaryLines = clipLine(GeomUtils.segment(gf, env.getMinX(), yc, env.getMaxX(), yc));
            for (LineString piece : primaryLines) {
                Envelope pe = piece.getEnvelopeInternal();
                Geometry foot = GeomUtils.intersection(GeomUtils.rect(gf, pe.getMinX(), yc - half, pe.getMaxX(), yc + half), localDev);
                if (foot.getArea() < GeomUtils.AREA_EPS) continue;
                roads.add(new RoadDraft(piece, d.primaryW, RoadClass.PRIMARY, foot));
                primaryFeet.add(foot);
            }
            if (primaryFeet.isEmpty()) return finish();
            Geometry primaryFoot = GeomUtils.union(primaryFeet, gf);

            // 4. partición recursiva en manzanas
            List<Double> cuts = new ArrayList<>();
            split(env.getMinX(), env.getMaxX(), 0, cuts);
            Collections.sort(cuts);
            Geometry[] secondaryFeet = new Geometry[cuts.size()];
            for (int i=0;i<cuts.size();i++) {
                secondaryFeet[i] = addSecondary(cuts.get(i), yc, primaryFoot, primaryLines);
            }

            // 5. franjas de lotes a ambos lados de la vía principal
            double ws = d.roadW;
            for (int b=0;b<=cuts.size();b++) {
                double bx0 = b == 0 ? env.getMinX() : cuts.get(b-1) + ws / 2;
                double bx1 = b == cuts.size() ? env.getMaxX() : cuts.get(b) - ws / 2;
                if (bx1 - bx0 <= EDGE_PROBE) continue;
                Block blk = new Block(bx0, bx1,
                        b == 0 ? null : secondaryFeet[b-1], b == cuts.size() ? null : secondaryFeet[b],
                        b == 0 ? Double.NaN : cuts.get(b-1), b == cuts.size() ? Double.NaN : cuts.get(b));
                fillHalf(blk, yc + half, +1, primaryFoot);
                fillHalf(blk, yc - half, -1, primaryFoot);
            }

            // 7. verde mínimo: se convierten los lotes de menor calidad bajo el tope
            allocateGreen();
            return finish();
        }

        void split(double a, double b, int depth, List<Double> out) {
            double len = b - a, ws = d.roadW;
            if (depth >= MAX_SPLIT_DEPTH || len <= d.maxBlock || len < 2 * d.minBlock + ws) return;
            double mid = (a + b) / 2, best = Double.NaN;
            for (int k=0;k<Genome.CUT_COUNT;k++) {
                double x = env.getMinX() + genome.cut(k) * env.getWidth();
                boolean fits = x - ws / 2 - a >= d.minBlock && b - x - ws / 2 >= d.minBlock;
                if (fits && (Double.isNaN(best) || Math.abs(x - mid) < Math.abs(best - mid))) best = x;
            }
            if (Double.isNaN(best)) best = mid;
            out.add(best);
            split(a, best - ws / 2, depth + 1, out);
            split(best + ws / 2, b, depth + 1, out);
        }

        Geometry addSecondary(double xc, double yc, Geometry primaryFoot, List<LineString> primaryLines) {
            double ws = d.roadW;
            List<Geometry> feet = new ArrayList<>();
            for (LineString piece : clipLine(GeomUtils.segment(gf, xc, env.getMinY(), xc, env.getMaxY()))) {
                Envelope pe = piece.getEnvelopeInternal();
                Geometry foot = GeomUtils.difference(
                        GeomUtils.intersection(GeomUtils.rect(gf, xc - ws / 2, pe.getMinY(), xc + ws / 2, pe.getMaxY()), localDev),
                        primaryFoot);
                if (foot.getArea() < GeomUtils.AREA_EPS) continue;
                roads.add(new RoadDraft(piece, ws, RoadClass.SECONDARY, foot));
                feet.add(foot);
                Point cross = gf.createPoint(new Coordinate(xc, yc));
                if (piece.distance(cross) <= RoadNetwork.SNAP_EPS && touchesAny(primaryLines, cross)) {
                    junctions.add(cross.getCoordinate());
                }
            }
            return feet.isEmpty() ? null : GeomUtils.union(feet, gf);
        }

        // llena media manzana alejándose de la vía principal en sentido sign (+1 arriba, -1 abajo)
        void fillHalf(Block blk, double base, int sign, Geometry primaryFoot) {
            Polygon halfRect = sign > 0
                    ? GeomUtils.rect(gf, blk.x0, base, blk.x1, env.getMaxY())
                    : GeomUtils.rect(gf, blk.x0, env.getMinY(), blk.x1, base);
            if (halfRect.getArea() < GeomUtils.AREA_EPS) return;
            Geometry region = GeomUtils.intersection(halfRect, localDev);
            if (region.getArea() < GeomUtils.AREA_EPS) return;
            Envelope re = region.getEnvelopeInternal();
            double avail = sign > 0 ? re.getMaxY() - base : base - re.getMinY();
            double sx0 = Math.max(blk.x0, re.getMinX()), sx1 = Math.min(blk.x1, re.getMaxX());

            double pos = 0;
            double front = Math.min(d.lotL, avail);
            strip(blk, sx0, sx1, base, sign, pos, front, true, primaryFoot);
            pos += front;
            if (!d.localRoads) return;

            double wl = d.roadW;
            while (pos + d.lotL + wl + LAST_STRIP_MIN * d.lotL <= avail) {
                Geometry localFoot = addLocal(blk, base, sign, pos + d.lotL, wl);
                if (localFoot == null) break;
                strip(blk, sx0, sx1, base, sign, pos, d.lotL, false, localFoot);
                pos += d.lotL + wl;
                double depth = Math.min(d.lotL, avail - pos);
                strip(blk, sx0, sx1, base, sign, pos, depth, true, localFoot);
                pos += depth;
            }
        }

        Geometry addLocal(Block blk, double base, int sign, double from, double wl) {
            double ya = base + sign * from, yb = base + sign * (from + wl), y = (ya + yb) / 2;
            double lx0 = Double.isNaN(blk.leftX) ? blk.x0 : blk.leftX;
            double lx1 = Double.isNaN(blk.rightX) ? blk.x1 : blk.rightX;
            List<Geometry> feet = new ArrayList<>();
            List<RoadDraft> pending = new ArrayList<>();
            for (LineString piece : clipLine(GeomUtils.segment(gf, lx0, y, lx1, y))) {
                Envelope pe = piece.getEnvelopeInternal();
                double fx0 = Math.max(pe.getMinX(), blk.x0), fx1 = Math.min(pe.getMaxX(), blk.x1);
                if (fx1 - fx0 <= EDGE_PROBE) continue;
                Geometry foot = GeomUtils.intersection(GeomUtils.rect(gf, fx0, ya, fx1, yb), localDev);
                if (foot.getArea() < GeomUtils.AREA_EPS) continue;
                pending.add(new RoadDraft(piece, wl, RoadClass.LOCAL, foot));
                feet.add(foot);
            }
            if (feet.isEmpty()) return null;
            roads.addAll(pending);
            return GeomUtils.union(feet, gf);
        }

        void strip(Block blk, double sx0, double sx1, double base, int sign, double pos, double depth,
                   boolean facesNear, Geometry roadFoot) {
            double span = sx1 - sx0;
            if (depth <= EDGE_PROBE * 10 || span <= EDGE_PROBE * 10) return;
            double y0 = base + sign * pos, y1 = base + sign * (pos + depth);
            double frontY = facesNear ? y0 : y1;
            int toRoad = facesNear ? -sign : sign;

            double w = d.lotW;
            if (depth < d.lotL - EDGE_PROBE) {
                // franja poco profunda: lotes más anchos para conservar área y proporción
                w = Math.max(Math.max(depth / d.aspect, d.minFrontage), d.minArea / depth);
            }
            int n = (int) Math.floor(span / w + 1e-9);
            if (Double.isFinite(d.maxArea)) n = Math.max(n, (int) Math.ceil(span * depth / d.maxArea));
            Geometry stripClip = GeomUtils.intersection(GeomUtils.rect(gf, sx0, y0, sx1, y1), localDev);

            List<Polygon> kept = new ArrayList<>();
            double lw = n > 0 ? span / n : 0;
            for (int i=0;i<n;i++) {
                double lx0 = sx0 + i * lw, lx1 = i == n - 1 ? sx1 : sx0 + (i + 1) * lw;
                Polygon lot = GeomUtils.largestPolygon(GeomUtils.intersection(GeomUtils.rect(gf, lx0, y0, lx1, y1), localDev), gf);
                if (lot.isEmpty() || lot.getArea() < GeomUtils.AREA_EPS) continue;

                double frontage = frontage(lot, lx0, lx1, frontY, toRoad, roadFoot);
                double side = 0;
                if (i == 0 && blk.leftFoot != null) side = Math.max(side, side(lot, lx0, y0, y1, -1, blk.leftFoot));
                if (i == n - 1 && blk.rightFoot != null) side = Math.max(side, side(lot, lx1, y0, y1, +1, blk.rightFoot));
                boolean corner = side >= Math.max(EDGE_PROBE * 10, CORNER_SIDE_MIN * d.minFrontage);

                double area = lot.getArea();
                double aspect = ShapeQuality.aspectRatio(lot);
                if (!within(area, d.minArea, d.maxArea) || !within(frontage, d.minFrontage, Double.POSITIVE_INFINITY)
                        || !within(aspect, d.aspectLo, d.aspectHi)) {
                    continue;
                }
                double quality = ShapeQuality.quality(
                        ShapeQuality.regularity(lot, d.aspectLo, d.aspectHi),
                        ShapeQuality.frontageScore(frontage, d.minFrontage), corner);
                drafts.add(new LotDraft(lot, frontage, aspect, corner, quality));
                kept.add(lot);
            }

            // recortes, lotes rechazados y sobrantes de franja quedan como verde
            Geometry leftover = kept.isEmpty() ? stripClip : GeomUtils.difference(stripClip, GeomUtils.union(kept, gf));
            for (Polygon p : GeomUtils.polygons(leftover)) {
                if (p.getArea() > GeomUtils.AREA_EPS) fragments.add(p);
            }
        }

        // frente efectivo: tramo del borde del lote que además linda con la vía
        double frontage(Polygon lot, double x0, double x1, double frontY, int toRoad, Geometry roadFoot) {
            if (roadFoot == null) return 0.0;
            double inLot = GeomUtils.clip(GeomUtils.segment(gf, x0, frontY - toRoad * EDGE_PROBE, x1, frontY - toRoad * EDGE_PROBE),
                    lot).getLength();
            double onRoad = GeomUtils.clip(GeomUtils.segment(gf, x0, frontY + toRoad * EDGE_PROBE, x1, frontY + toRoad * EDGE_PROBE),
                    roadFoot).getLength();
            return Math.min(inLot, onRoad);
        }

        double side(Polygon lot, double x, double y0, double y1, int toRoad, Geometry roadFoot) {
            double inLot = GeomUtils.clip(GeomUtils.segment(gf, x - toRoad * EDGE_PROBE, y0, x - toRoad * EDGE_PROBE, y1),
                    lot).getLength();
            double onRoad = GeomUtils.clip(GeomUtils.segment(gf, x + toRoad * EDGE_PROBE, y0, x + toRoad * EDGE_PROBE, y1),
                    roadFoot).getLength();
            return Math.min(inLot, onRoad);
        }

        void allocateGreen() {
            double need = d.greenRatio * boundary.getArea();
            double have = GeomUtils.totalArea(bufferGreens) + GeomUtils.totalArea(fragments);
            if (have >= need || drafts.isEmpty()) return;
            List<LotDraft> order = new ArrayList<>(drafts);
            order.sort(Comparator.comparingDouble((LotDraft l) -> l.quality));
            for (LotDraft l : order) {
                if (have >= need) break;
                if (l.quality >= d.greenCap) break;
                l.park = true;
                have += l.polygon.getArea();
            }
        }

        Layout finish() {
            List<GreenArea> greens = new ArrayList<>();
            for (Polygon p : bufferGreens) greens.add(new GreenArea(GreenArea.Kind.BUFFER, p));
            for (Polygon p : fragments) greens.add(new GreenArea(GreenArea.Kind.FRAGMENT, world(p)));

            List<Lot> lots = new ArrayList<>();
            for (LotDraft l : drafts) {
                Polygon wp = world(l.polygon);
                if (l.park) {
                    greens.add(new GreenArea(GreenArea.Kind.PARK, wp));
                    continue;
                }
                lots.add(new Lot(lots.size(), wp, l.frontage, l.aspect, l.corner, zone(wp), l.quality));
            }

            List<Road> out = new ArrayList<>();
            RoadNetwork.Builder net = new RoadNetwork.Builder();
            for (RoadDraft r : roads) {
                LineString c = (LineString) toWorld.transform(r.centerline);
                out.add(new Road(out.size(), c, r.width, r.cls, toWorld.transform(r.foot)));
                net.add(c, r.width, r.cls);
            }
            for (Coordinate j : junctions) {
                Coordinate w = new Coordinate();
                toWorld.transform(j, w);
                net.junction(w.x, w.y);
            }
            return new Layout(genome, site.boundary(), lots, out, net.build(), greens);
        }

        ZoneType zone(Polygon lot) {
            for (Polygon z : site.preferredZones()) {
                if (lot.intersects(z) && GeomUtils.intersection(lot, z).getArea() > GeomUtils.AREA_EPS) return ZoneType.OFFICE;
            }
            return lot.getArea() >= d.factoryArea ? ZoneType.FACTORY : ZoneType.WAREHOUSE;
        }

        Polygon world(Polygon local) {
            return toWorld == null ? local : (Polygon) toWorld.transform(local);
        }

        List<LineString> clipLine(LineString line) {
            Geometry g = GeomUtils.clip(line, localDev);
            List<LineString> out = new ArrayList<>();
            for (int i=0;i<g.getNumGeometries();i++) {
                Geometry c = g.getGeometryN(i);
                if (c instanceof LineString ls && ls.getLength() > EDGE_PROBE) out.add(ls);
            }
            return out;
        }

        static boolean touchesAny(List<LineString> lines, Point p) {
            for (LineString l : lines) if (l.distance(p) <= RoadNetwork.SNAP_EPS) return true;
            return false;
        }
    }

    // mismo criterio de tolerancia que las reglas
    static boolean within(double v, double lo, double hi) {
        if (Double.isNaN(v)) return false;
        double tlo = Double.isInfinite(lo) ? 0 : Rule.REL_TOL * Math.max(1.0, Math.abs(lo));
        double thi = Double.isInfinite(hi) ? 0 : Rule.REL_TOL * Math.max(1.0, Math.abs(hi));
        return v >= lo - tlo && v <= hi + thi;
    }

    private static final class Block {
        final double x0, x1;
        final Geometry leftFoot, rightFoot;
        final double leftX, rightX;

        Block(double x0, double x1, Geometry leftFoot, Geometry rightFoot, double leftX, double rightX) {
            this.x0 = x0; this.x1 = x1;
            this.leftFoot = leftFoot; this.rightFoot = rightFoot;
            this.leftX = leftX; this.rightX = rightX;
        }
    }

    private static final class LotDraft {
        final Polygon polygon;
        final double frontage, aspect, quality;
        final boolean corner;
        boolean park;

        LotDraft(Polygon polygon, double frontage, double aspect, boolean corner, double quality) {
            this.polygon = polygon;
            this.frontage = frontage;
            this.aspect = aspect;
            this.corner = corner;
            this.quality = quality;
        }
    }

    private static final class RoadDraft {
        final LineString centerline;
        final double width;
        final RoadClass cls;
        final Geometry foot;

        RoadDraft(LineString centerline, double width, RoadClass cls, Geometry foot) {
            this.centerline = centerline;
            this.width = width;
            this.cls = cls;
            this.foot = foot;
        }
    }
}
