package org.tesis.loteo;

// reglas por lote: actual = peor valor, count = lotes que fallan; reglas de layout: count = 1
public record Violation(String rule, double actual, Rule required, double magnitude, int count) {

    public Rule.Priority priority() {
        return required.priority();
    }

    public boolean isHard() {
        return required.isHard();
    }

    @Override
    public String toString() {
        return rule + ": " + Rule.fmt(actual) + " (requiere " + required + ", n=" + count + ")";
    }
}
