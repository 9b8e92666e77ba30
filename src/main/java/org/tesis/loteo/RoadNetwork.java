package org.tesis.loteo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;

import java.util.*;

/**
 * Grafo vial en forma de arena: coordenadas de nodos en arreglos paralelos y aristas como pares
 * de índices. Sin referencias cruzadas entre objetos; inmutable una vez construido.
 */
public final class RoadNetwork {

    static final double SNAP_EPS = 1e-6;

    private final double[] xs, ys;
    private final int[] from, to;
    private final double[] widths;
    private final RoadClass[] classes;

    private RoadNetwork(double[] xs, double[] ys, int[] from, int[] to, double[] widths, RoadClass[] classes) {
        this.xs = xs;
        this.ys = ys;
        this.from = from;
        this.to = to;
        this.widths = widths;
        this.classes = classes;
    }

    static RoadNetwork empty() {
        return new Builder().build();
    }

    public int nodeCount()               { return xs.length; }
    public int edgeCount()               { return from.length; }
    public double nodeX(int n)           { return xs[n]; }
    public double nodeY(int n)           { return ys[n]; }
    public int edgeFrom(int e)           { return from[e]; }
    public int edgeTo(int e)             { return to[e]; }
    public double edgeWidth(int e)       { return widths[e]; }
    public RoadClass edgeClass(int e)    { return classes[e]; }

    public double edgeLength(int e) {
        return Math.hypot(xs[to[e]] - xs[from[e]], ys[to[e]] - ys[from[e]]);
    }

    public double totalLength() {
        double s = 0;
        for (int e=0;e<from.length;e++) s += edgeLength(e);
        return s;
    }

    public int degree(int n) {
        int d = 0;
        for (int e=0;e<from.length;e++) {
            if (from[e] == n) d++;
            if (to[e] == n) d++;
        }
        return d;
    }

    // cantidad de componentes conexas (nodos aislados no existen: todo nodo nace de una arista)
    public int componentCount() {
        int n = xs.length;
        if (n == 0) return 0;
        int[] parent = new int[n];
        for (int i=0;i<n;i++) parent[i] = i;
        int comps = n;
        for (int e=0;e<from.length;e++) {
            int a = find(parent, from[e]), b = find(parent, to[e]);
            if (a != b) { parent[a] = b; comps--; }
        }
        return comps;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    @Override
    public String toString() {
        return "RoadNetwork{nodos=" + nodeCount() + ", aristas=" + edgeCount() + "}";
    }

    /**
     * Acumula polilíneas; los nodos se unifican por coordenada y al construir cada arista se parte
     * en los nodos que caen sobre ella (cruces en T y en X).
     */
    static final class Builder {
        private final List<double[]> nodes = new ArrayList<>();
        private final Map<Long, Integer> index = new HashMap<>();
        private final List<int[]> edges = new ArrayList<>();
        private final List<Double> edgeWidths = new ArrayList<>();
        private final List<RoadClass> edgeClasses = new ArrayList<>();

        Builder add(LineString line, double width, RoadClass cls) {
            Coordinate[] c = line.getCoordinates();
            for (int i=1;i<c.length;i++) {
                int a = node(c[i-1].x, c[i-1].y), b = node(c[i].x, c[i].y);
                if (a == b) continue;
                edges.add(new int[]{a, b});
                edgeWidths.add(width);
                edgeClasses.add(cls);
            }
            return this;
        }

        // los cruces que no coinciden con un vértice se agregan como nodo explícito
        Builder junction(double x, double y) {
            node(x, y);
            return this;
        }

        private int node(double x, double y) {
            long key = key(x, y);
            Integer id = index.get(key);
            if (id != null) return id;
            for (int i=0;i<nodes.size();i++) {
                double[] p = nodes.get(i);
                if (Math.abs(p[0] - x) <= SNAP_EPS && Math.abs(p[1] - y) <= SNAP_EPS) {
                    index.put(key, i);
                    return i;
                }
            }
            nodes.add(new double[]{x, y});
            index.put(key, nodes.size() - 1);
            return nodes.size() - 1;
        }

        private static long key(double x, double y) {
            return 31L * Double.doubleToLongBits(x + 0.0) + Double.doubleToLongBits(y + 0.0);
        }

        RoadNetwork build() {
            List<int[]> outEdges = new ArrayList<>();
            List<Double> outW = new ArrayList<>();
            List<RoadClass> outC = new ArrayList<>();
            for (int e=0;e<edges.size();e++) {
                int a = edges.get(e)[0], b = edges.get(e)[1];
                List<Integer> chain = splitPoints(a, b);
                for (int i=1;i<chain.size();i++) {
                    outEdges.add(new int[]{chain.get(i-1), chain.get(i)});
                    outW.add(edgeWidths.get(e));
                    outC.add(edgeClasses.get(e));
                }
            }
            int n = nodes.size(), m = outEdges.size();
            double[] xs = new double[n], ys = new double[n];
            for (int i=0;i<n;i++) { xs[i] = nodes.get(i)[0]; ys[i] = nodes.get(i)[1]; }
            int[] from = new int[m], to = new int[m];
            double[] w = new double[m];
            RoadClass[] cls = new RoadClass[m];
            for (int i=0;i<m;i++) {
                from[i] = outEdges.get(i)[0];
                to[i] = outEdges.get(i)[1];
                w[i] = outW.get(i);
                cls[i] = outC.get(i);
            }
            return new RoadNetwork(xs, ys, from, to, w, cls);
        }

        // nodos interiores al segmento a-b, ordenados desde a
        private List<Integer> splitPoints(int a, int b) {
            double[] pa = nodes.get(a), pb = nodes.get(b);
            double dx = pb[0] - pa[0], dy = pb[1] - pa[1];
            double len2 = dx * dx + dy * dy;
            TreeMap<Double, Integer> inner = new TreeMap<>();
            for (int i=0;i<nodes.size();i++) {
                if (i == a || i == b) continue;
                double[] p = nodes.get(i);
                double t = ((p[0] - pa[0]) * dx + (p[1] - pa[1]) * dy) / len2;
                if (t <= 0 || t >= 1) continue;
                double cx = pa[0] + t * dx, cy = pa[1] + t * dy;
                if (Math.hypot(p[0] - cx, p[1] - cy) <= SNAP_EPS) inner.put(t, i);
            }
            List<Integer> chain = new ArrayList<>();
            chain.add(a);
            chain.addAll(inner.values());
            chain.add(b);
            return chain;
        }
    }
}
