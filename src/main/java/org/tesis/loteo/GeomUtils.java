package org.tesis.loteo;

import org.locationtech.jts.algorithm.MinimumDiameter;
import org.locationtech.jts.geom.*;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.operation.overlayng.OverlayNG;
import org.locationtech.jts.operation.overlayng.OverlayNGRobust;

import java.util.*;
import java.util.stream.Collectors;

public class GeomUtils {

    static final double AREA_EPS = 1e-6;

    // construye los polígonos de una entidad (anillo 0 = exterior, >0 = huecos), en orden de id
    static Map<String, Polygon> buildPolygons(List<VertexRow> rows, String entityType, GeometryFactory gf) {
        Map<String, List<VertexRow>> byId = rows.stream()
                .filter(r -> r.is(entityType))
                .collect(Collectors.groupingBy(r -> r.entityId, TreeMap::new, Collectors.toList()));

        Map<String, Polygon> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<VertexRow>> e : byId.entrySet()) {
            Map<Integer, List<VertexRow>> byRing = e.getValue().stream()
                    .collect(Collectors.groupingBy(r -> r.ring, TreeMap::new, Collectors.toList()));
            List<VertexRow> outer = byRing.remove(0);
            if (outer == null) {
                throw new IllegalArgumentException(entityType + " " + e.getKey() + " no tiene anillo exterior (ring=0)");
            }
            LinearRing shell = gf.createLinearRing(toClosedCoords(sorted(outer)));
            LinearRing[] holes = new LinearRing[byRing.size()];
            int i = 0;
            for (List<VertexRow> hole : byRing.values()) {
                holes[i++] = gf.createLinearRing(toClosedCoords(sorted(hole)));
            }
            out.put(e.getKey(), gf.createPolygon(shell, holes));
        }
        return out;
    }

    // construye polilíneas abiertas (guías de alineación de vías)
    static List<LineString> buildLines(List<VertexRow> rows, String entityType, GeometryFactory gf) {
        Map<String, List<VertexRow>> byId = rows.stream()
                .filter(r -> r.is(entityType))
                .collect(Collectors.groupingBy(r -> r.entityId, TreeMap::new, Collectors.toList()));
        List<LineString> out = new ArrayList<>();
        for (List<VertexRow> pts : byId.values()) {
            List<VertexRow> s = sorted(pts);
            if (s.size() < 2) throw new IllegalArgumentException("Guía requiere >=2 puntos: " + s.get(0).entityId);
            Coordinate[] c = new Coordinate[s.size()];
            for (int i=0;i<s.size();i++) c[i] = new Coordinate(s.get(i).x, s.get(i).y);
            out.add(gf.createLineString(c));
        }
        return out;
    }

    static List<VertexRow> sorted(List<VertexRow> pts) {
        List<VertexRow> s = new ArrayList<>(pts);
        s.sort(Comparator.comparingInt(r -> r.pointIdx));
        return s;
    }

    // convierte la lista de vértices en un arreglo de coordenadas cerrado (último = primero)
    static Coordinate[] toClosedCoords(List<VertexRow> pts) {
        if (pts.size() < 3) throw new IllegalArgumentException("Polígono requiere >=3 puntos");
        VertexRow first = pts.get(0), last = pts.get(pts.size()-1);
        boolean closed = first.x == last.x && first.y == last.y;
        int n = closed ? pts.size() : pts.size() + 1;
        Coordinate[] c = new Coordinate[n];
        for (int i=0;i<pts.size();i++) c[i] = new Coordinate(pts.get(i).x, pts.get(i).y);
        if (!closed) c[n-1] = new Coordinate(first.x, first.y);
        return c;
    }

    // el polígono de mayor área dentro de una geometría (vacío si no hay ninguno)
    static Polygon largestPolygon(Geometry g, GeometryFactory gf) {
        Polygon best = null; double area = -1;
        for (Polygon p : polygons(g)) {
            if (p.getArea() > area) { area = p.getArea(); best = p; }
        }
        return best != null ? best : gf.createPolygon();
    }

    // aplana una geometría cualquiera a sus polígonos no vacíos
    static List<Polygon> polygons(Geometry g) {
        List<Polygon> out = new ArrayList<>();
        if (g == null || g.isEmpty()) return out;
        if (g instanceof Polygon p) {
            out.add(p);
        } else if (g instanceof GeometryCollection gc) {
            for (int i=0;i<gc.getNumGeometries();i++) out.addAll(polygons(gc.getGeometryN(i)));
        }
        return out;
    }

    static double totalArea(Collection<? extends Geometry> gs) {
        double a = 0;
        for (Geometry g : gs) a += g.getArea();
        return a;
    }

    // unión areal; las partes de dimensión menor se descartan
    static Geometry union(Collection<? extends Geometry> gs, GeometryFactory gf) {
        List<Geometry> parts = new ArrayList<>();
        for (Geometry g : gs) {
            Geometry p = polygonal(g, gf);
            if (!p.isEmpty()) parts.add(p);
        }
        if (parts.isEmpty()) return gf.createPolygon();
        return polygonal(OverlayNGRobust.union(parts), gf);
    }

    // intersección y diferencia areales: entradas y salida se reducen a sus polígonos,
    // así una franja que solo toca un hueco no deja líneas ni puntos en la cadena de recortes
    static Geometry intersection(Geometry a, Geometry b) {
        return overlay(a, b, OverlayNG.INTERSECTION);
    }

    static Geometry difference(Geometry a, Geometry b) {
        return overlay(a, b, OverlayNG.DIFFERENCE);
    }

    private static Geometry overlay(Geometry a, Geometry b, int op) {
        GeometryFactory gf = a.getFactory();
        Geometry pa = polygonal(a, gf), pb = polygonal(b, gf);
        if (pa.isEmpty()) return pa;
        if (pb.isEmpty()) return op == OverlayNG.INTERSECTION ? gf.createPolygon() : pa;
        return polygonal(OverlayNGRobust.overlay(pa, pb, op), gf);
    }

    // recorta una línea contra un área (resultado lineal)
    static Geometry clip(LineString line, Geometry area) {
        Geometry pa = polygonal(area, line.getFactory());
        if (pa.isEmpty()) return line.getFactory().createLineString();
        return OverlayNGRobust.overlay(line, pa, OverlayNG.INTERSECTION);
    }

    // parte poligonal de una geometría: Polygon, MultiPolygon o polígono vacío
    static Geometry polygonal(Geometry g, GeometryFactory gf) {
        if (g instanceof Polygon || g instanceof MultiPolygon) return g;
        List<Polygon> ps = polygons(g);
        if (ps.isEmpty()) return gf.createPolygon();
        if (ps.size() == 1) return ps.get(0);
        return gf.createMultiPolygon(ps.toArray(new Polygon[0]));
    }

    // rectángulo alineado a ejes (en el marco local del decodificador)
    static Polygon rect(GeometryFactory gf, double x0, double y0, double x1, double y1) {
        double minX = Math.min(x0, x1), maxX = Math.max(x0, x1);
        double minY = Math.min(y0, y1), maxY = Math.max(y0, y1);
        return gf.createPolygon(new Coordinate[]{
                new Coordinate(minX, minY), new Coordinate(maxX, minY),
                new Coordinate(maxX, maxY), new Coordinate(minX, maxY),
                new Coordinate(minX, minY)
        });
    }

    static LineString segment(GeometryFactory gf, double x0, double y0, double x1, double y1) {
        return gf.createLineString(new Coordinate[]{ new Coordinate(x0, y0), new Coordinate(x1, y1) });
    }

    // ángulo (radianes, en (-pi/2, pi/2]) del lado largo del rectángulo mínimo rotado
    static double longAxisAngle(Geometry g) {
        Geometry mr = new MinimumDiameter(g).getMinimumRectangle();
        Coordinate[] c = mr.getCoordinates();
        if (c.length < 3) return 0.0;
        double e1 = c[0].distance(c[1]), e2 = c[1].distance(c[2]);
        Coordinate a = e1 >= e2 ? c[0] : c[1];
        Coordinate b = e1 >= e2 ? c[1] : c[2];
        return normalizeAxis(Math.atan2(b.y - a.y, b.x - a.x));
    }

    // dirección de una polilínea de primer a último punto
    static double lineAngle(LineString ls) {
        Coordinate a = ls.getCoordinateN(0), b = ls.getCoordinateN(ls.getNumPoints()-1);
        return normalizeAxis(Math.atan2(b.y - a.y, b.x - a.x));
    }

    // un eje no tiene sentido: se lleva a (-pi/2, pi/2]
    static double normalizeAxis(double a) {
        while (a > Math.PI / 2) a -= Math.PI;
        while (a <= -Math.PI / 2) a += Math.PI;
        if (Math.abs(a) < 1e-12) a = 0.0;
        return a;
    }

    // rotación alrededor de un punto; ángulo cero devuelve la identidad exacta
    static AffineTransformation rotation(double angleRad, double cx, double cy) {
        if (angleRad == 0.0) return new AffineTransformation();
        return AffineTransformation.rotationInstance(angleRad, cx, cy);
    }
}
