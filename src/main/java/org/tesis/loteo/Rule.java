package org.tesis.loteo;

import java.util.Locale;

/**
 * Regla de una restricción: operador, umbral(es) y prioridad.
 * Se evalúa contra un valor medido; las comparaciones toleran un error relativo de 1e-9.
 */
public final class Rule {

    public enum Operator {
        AT_LEAST(">="), AT_MOST("<="), EQUALS("="), RANGE("range");

        final String symbol;
        Operator(String symbol) { this.symbol = symbol; }

        static Operator parse(String token) {
            switch (token.trim().toLowerCase(Locale.ROOT)) {
                case ">=": case "≥": case "min": return AT_LEAST;
                case "<=": case "≤": case "max": return AT_MOST;
                case "=": case "==": case "eq":  return EQUALS;
                case "range": case "between":    return RANGE;
                default: throw new IllegalArgumentException("Operador desconocido: " + token);
            }
        }
    }

    public enum Priority { HARD, SOFT }

    static final double REL_TOL = 1e-9;

    private final Operator operator;
    private final double low;
    private final double high;
    private final Priority priority;

    private Rule(Operator operator, double low, double high, Priority priority) {
        if (Double.isNaN(low) || Double.isNaN(high)) throw new IllegalArgumentException("Umbral NaN");
        if (low > high) throw new IllegalArgumentException("Rango invertido: " + low + " > " + high);
        this.operator = operator;
        this.low = low;
        this.high = high;
        this.priority = priority;
    }

    public static Rule atLeast(double t, Priority p)  { return new Rule(Operator.AT_LEAST, t, Double.POSITIVE_INFINITY, p); }
    public static Rule atMost(double t, Priority p)   { return new Rule(Operator.AT_MOST, Double.NEGATIVE_INFINITY, t, p); }
    public static Rule equalTo(double t, Priority p)  { return new Rule(Operator.EQUALS, t, t, p); }
    public static Rule range(double lo, double hi, Priority p) { return new Rule(Operator.RANGE, lo, hi, p); }

    public static Rule hardAtLeast(double t) { return atLeast(t, Priority.HARD); }
    public static Rule hardAtMost(double t)  { return atMost(t, Priority.HARD); }

    public Operator operator() { return operator; }
    public Priority priority() { return priority; }
    public boolean isHard()    { return priority == Priority.HARD; }

    // cota inferior efectiva (-inf si la regla no la impone)
    public double lowerBound() { return low; }

    // cota superior efectiva (+inf si la regla no la impone)
    public double upperBound() { return high; }

    public boolean test(double actual) {
        return shortfall(actual) == 0.0;
    }

    // distancia del valor medido al intervalo permitido (0 si cumple)
    public double shortfall(double actual) {
        if (Double.isNaN(actual)) return Double.POSITIVE_INFINITY;
        if (actual < low - tol(low))   return low - actual;
        if (actual > high + tol(high)) return actual - high;
        return 0.0;
    }

    // incumplimiento relativo al umbral, base del castigo blando
    public double magnitude(double actual) {
        double s = shortfall(actual);
        if (s == 0.0) return 0.0;
        if (Double.isInfinite(s)) return 1.0;
        double ref = actual < low ? low : high;
        return s / Math.max(1.0, Math.abs(ref));
    }

    private static double tol(double t) {
        return Double.isInfinite(t) ? 0.0 : REL_TOL * Math.max(1.0, Math.abs(t));
    }

    // texto legible del requisito, p.ej. ">= 2000" o "range [1.5, 2]"
    public String describe() {
        switch (operator) {
            case AT_LEAST: return ">= " + fmt(low);
            case AT_MOST:  return "<= " + fmt(high);
            case EQUALS:   return "= " + fmt(low);
            default:       return "range [" + fmt(low) + ", " + fmt(high) + "]";
        }
    }

    static String fmt(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) return Long.toString((long) v);
        return String.format(Locale.US, "%.4g", v);
    }

    @Override
    public String toString() {
        return describe() + " " + priority.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rule r)) return false;
        return operator == r.operator && Double.compare(low, r.low) == 0
                && Double.compare(high, r.high) == 0 && priority == r.priority;
    }

    @Override
    public int hashCode() {
        int h = operator.hashCode();
        h = 31 * h + Double.hashCode(low);
        h = 31 * h + Double.hashCode(high);
        return 31 * h + priority.hashCode();
    }
}
