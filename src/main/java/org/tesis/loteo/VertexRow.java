package org.tesis.loteo;

import java.util.Locale;

public class VertexRow {
    String entityType;   // BOUNDARY | EXCLUSION | PREFERRED | GUIDE
    String entityId;
    int ring;
    int pointIdx;
    double x, y;

    static VertexRow fromCsv(String[] h, String[] v) {
        VertexRow r = new VertexRow();
        r.entityType = get(v, idx(h, "entity_type")).toUpperCase(Locale.ROOT);
        r.entityId   = get(v, idx(h, "entity_id"));
        r.ring       = parseInt(getOpt(v, h, "ring"), 0);
        r.pointIdx   = parseInt(get(v, idx(h, "point_idx")), 0);
        r.x          = parseCoordinate(get(v, idx(h, "x")), "x", r);
        r.y          = parseCoordinate(get(v, idx(h, "y")), "y", r);
        return r;
    }

    boolean is(String type) {
        return type.equalsIgnoreCase(entityType);
    }

    // ------------- helpers CSV -------------
    static String[] splitCsv(String s) {
        String[] raw = s.split(",", -1);
        for (int i=0;i<raw.length;i++) raw[i] = raw[i].trim();
        return raw;
    }
    static int idx(String[] h, String name) {
        for (int i=0;i<h.length;i++) if (h[i].equalsIgnoreCase(name)) return i;
        throw new IllegalArgumentException("Cabecera CSV faltante: " + name);
    }
    static int idxOpt(String[] h, String name) {
        for (int i=0;i<h.length;i++) if (h[i].equalsIgnoreCase(name)) return i;
        return -1;
    }
    static String get(String[] v, int idx) {
        if (idx < 0 || idx >= v.length) return "";
        return v[idx];
    }
    static String getOpt(String[] v, String[] h, String name) {
        int i = idxOpt(h, name);
        return i == -1 ? "" : get(v, i);
    }

    static Integer parseNullableInt(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Integer.parseInt(s); } catch (NumberFormatException e) { return null; }
    }
    static Double parseNullableDouble(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Double.parseDouble(s); } catch (NumberFormatException e) { return null; }
    }
    static int parseInt(String s, int d) {
        Integer v = parseNullableInt(s); return v == null ? d : v;
    }

    // una coordenada ilegible no puede tomar un valor por defecto: deformaría el polígono
    static double parseCoordinate(String s, String col, VertexRow r) {
        Double v = parseNullableDouble(s);
        if (v == null || v.isNaN() || v.isInfinite()) {
            throw new IllegalArgumentException("Coordenada " + col + " inválida en " + r.entityType
                    + "/" + r.entityId + " punto " + r.pointIdx + ": '" + s + "'");
        }
        return v;
    }
}
