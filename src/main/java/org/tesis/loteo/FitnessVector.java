package org.tesis.loteo;

import java.util.Arrays;
import java.util.Locale;

/**
 * Objetivos en orden fijo, todos a maximizar: cantidad de lotes, calidad media, eficiencia vial
 * y objetivo financiero. values() ya viene castigado según factibilidad; raw() son los valores
 * medidos antes del castigo.
 */
public final class FitnessVector {

    public static final int LOT_COUNT       = 0;
    public static final int MEAN_QUALITY    = 1;
    public static final int ROAD_EFFICIENCY = 2;
    public static final int FINANCIAL       = 3;
    public static final int SIZE            = 4;

    static final String[] NAMES = {"lot_count", "mean_quality", "road_efficiency", "financial_objective"};

    private final double[] values;
    private final double[] raw;
    private final boolean[] failed;
    private final ConstraintReport report;

    FitnessVector(double[] values, double[] raw, boolean[] failed, ConstraintReport report) {
        this.values = values;
        this.raw = raw;
        this.failed = failed;
        this.report = report;
    }

    public double value(int i)          { return values[i]; }
    public double raw(int i)            { return raw[i]; }
    public boolean failed(int i)        { return failed[i]; }
    public double[] values()            { return values.clone(); }
    public ConstraintReport report()    { return report; }
    public boolean feasible()           { return report.feasible(); }
    public double financial()           { return values[FINANCIAL]; }

    public boolean anyFailed() {
        for (boolean f : failed) if (f) return true;
        return false;
    }

    // domina: no peor en ningún objetivo y estrictamente mejor en alguno
    public boolean dominates(FitnessVector o) {
        boolean better = false;
        for (int i=0;i<SIZE;i++) {
            if (values[i] < o.values[i]) return false;
            if (values[i] > o.values[i]) better = true;
        }
        return better;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Fitness{");
        for (int i=0;i<SIZE;i++) {
            if (i > 0) sb.append(", ");
            sb.append(NAMES[i]).append('=');
            sb.append(failed[i] ? "FALLA" : String.format(Locale.US, "%.3f", raw[i]));
        }
        return sb.append(report.feasible() ? ", factible}" : ", infactible}").toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FitnessVector f)) return false;
        return Arrays.equals(values, f.values) && Arrays.equals(raw, f.raw) && Arrays.equals(failed, f.failed);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + Arrays.hashCode(failed);
    }
}
