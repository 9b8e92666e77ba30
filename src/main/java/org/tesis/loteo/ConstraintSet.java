package org.tesis.loteo;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Conjunto inmutable de restricciones: nombre de parámetro → {@link Rule}.
 *
 * <p>Formato de archivo (java.util.Properties), una regla por clave:
 * <pre>
 * min_lot_size      = &gt;= 2000 hard
 * green_space_ratio = &gt;= 0.15 soft
 * lot_aspect_ratio  = range 1.5 2.0
 * </pre>
 * La prioridad por defecto es {@code hard}.
 */
public final class ConstraintSet {

    public static final String MIN_LOT_SIZE       = "min_lot_size";
    public static final String MAX_LOT_SIZE       = "max_lot_size";
    public static final String MIN_FRONTAGE       = "min_frontage";
    public static final String LOT_ASPECT_RATIO   = "lot_aspect_ratio";
    public static final String GREEN_SPACE_RATIO  = "green_space_ratio";
    public static final String BUFFER_WIDTH       = "buffer_width";
    public static final String ROAD_WIDTH         = "road_width";
    public static final String PRIMARY_ROAD_WIDTH = "primary_road_width";
    public static final String MAX_SLOPE          = "max_slope";
    public static final String LOT_COUNT          = "lot_count";
    public static final String ROAD_AREA_RATIO    = "road_area_ratio";

    static final Set<String> KNOWN = Set.of(
            MIN_LOT_SIZE, MAX_LOT_SIZE, MIN_FRONTAGE, LOT_ASPECT_RATIO, GREEN_SPACE_RATIO,
            BUFFER_WIDTH, ROAD_WIDTH, PRIMARY_ROAD_WIDTH, MAX_SLOPE, LOT_COUNT, ROAD_AREA_RATIO);

    private static final ConstraintSet EMPTY = new ConstraintSet(new TreeMap<>());

    private final SortedMap<String, Rule> rules;

    private ConstraintSet(SortedMap<String, Rule> rules) {
        this.rules = Collections.unmodifiableSortedMap(rules);
    }

    public static ConstraintSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Rule> rule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public boolean has(String name) {
        return rules.containsKey(name);
    }

    // reglas en orden alfabético de parámetro (orden estable de los reportes)
    public SortedMap<String, Rule> rules() {
        return rules;
    }

    // cota inferior impuesta por la regla, o el valor por defecto si no existe o no acota por abajo
    public double lowerBound(String name, double fallback) {
        Rule r = rules.get(name);
        if (r == null || Double.isInfinite(r.lowerBound())) return fallback;
        return r.lowerBound();
    }

    public double upperBound(String name, double fallback) {
        Rule r = rules.get(name);
        if (r == null || Double.isInfinite(r.upperBound())) return fallback;
        return r.upperBound();
    }

    public int size() {
        return rules.size();
    }

    // ------------- lectura -------------

    public static ConstraintSet read(Path path) throws IOException {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(r);
        }
    }

    public static ConstraintSet read(Reader reader) throws IOException {
        Properties p = new Properties();
        p.load(reader);
        return fromProperties(p);
    }

    public static ConstraintSet fromProperties(Properties p) {
        Builder b = builder();
        for (String name : new TreeSet<>(p.stringPropertyNames())) {
            b.put(name, parseRule(name, p.getProperty(name)));
        }
        return b.build();
    }

    // "<op> <t1> [t2] [hard|soft]"
    static Rule parseRule(String name, String text) {
        String[] tok = text.trim().split("\\s+");
        if (tok.length < 2) throw new IllegalArgumentException("Regla incompleta para " + name + ": '" + text + "'");
        Rule.Operator op = Rule.Operator.parse(tok[0]);
        int next = 1;
        double t1 = number(name, tok[next++]);
        double t2 = Double.NaN;
        if (op == Rule.Operator.RANGE) {
            if (tok.length < 3) throw new IllegalArgumentException("Rango requiere dos umbrales: " + name);
            t2 = number(name, tok[next++]);
        }
        Rule.Priority pr = Rule.Priority.HARD;
        if (next < tok.length) {
            String s = tok[next++].toLowerCase(Locale.ROOT);
            if (s.equals("soft")) pr = Rule.Priority.SOFT;
            else if (!s.equals("hard")) throw new IllegalArgumentException("Prioridad desconocida en " + name + ": " + s);
        }
        if (next < tok.length) throw new IllegalArgumentException("Texto sobrante en " + name + ": '" + text + "'");
        switch (op) {
            case AT_LEAST: return Rule.atLeast(t1, pr);
            case AT_MOST:  return Rule.atMost(t1, pr);
            case EQUALS:   return Rule.equalTo(t1, pr);
            default:       return Rule.range(t1, t2, pr);
        }
    }

    private static double number(String name, String s) {
        try {
            double v = Double.parseDouble(s);
            if (Double.isNaN(v)) throw new NumberFormatException("NaN");
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Umbral no numérico en " + name + ": '" + s + "'", e);
        }
    }

    public static final class Builder {
        private final SortedMap<String, Rule> rules = new TreeMap<>();

        public Builder put(String name, Rule rule) {
            Objects.requireNonNull(rule, "rule");
            if (!KNOWN.contains(name)) throw new IllegalArgumentException("Parámetro de restricción desconocido: " + name);
            rules.put(name, rule);
            return this;
        }

        public ConstraintSet build() {
            return new ConstraintSet(new TreeMap<>(rules));
        }
    }

    @Override
    public String toString() {
        return "ConstraintSet" + rules;
    }
}
