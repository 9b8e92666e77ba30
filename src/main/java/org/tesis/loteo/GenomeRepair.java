package org.tesis.loteo;

import java.util.Arrays;

/**
 * Lleva cualquier genoma a uno estructuralmente válido. Nunca lanza excepciones y es
 * idempotente: repair(repair(g)) == repair(g).
 */
public final class GenomeRepair {

    static final double NEUTRAL = 0.5;

    private GenomeRepair() {
    }

    public static Genome repair(Genome raw) {
        return raw == null ? canonical() : repair(raw.toArray());
    }

    public static Genome repair(double[] raw) {
        double[] g = new double[Genome.LENGTH];
        int n = raw == null ? 0 : Math.min(raw.length, Genome.LENGTH);
        for (int i=0;i<n;i++) g[i] = clamp(raw[i]);
        for (int i=n;i<Genome.LENGTH;i++) g[i] = NEUTRAL;

        // los cortes deben quedar ordenados de menor a mayor
        Arrays.sort(g, Genome.FIRST_CUT, Genome.FIRST_CUT + Genome.CUT_COUNT);
        return Genome.wrap(g);
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) return NEUTRAL;
        if (v <= 0.0) return 0.0;   // incluye -0.0 y -inf
        if (v >= 1.0) return 1.0;
        return v;
    }

    // genoma de referencia: valores medios y cortes equiespaciados
    public static Genome canonical() {
        double[] g = new double[Genome.LENGTH];
        Arrays.fill(g, NEUTRAL);
        for (int k=0;k<Genome.CUT_COUNT;k++) g[Genome.FIRST_CUT + k] = (k + 1.0) / (Genome.CUT_COUNT + 1.0);
        return Genome.wrap(g);
    }

    public static boolean isValid(Genome g) {
        if (g == null || g.length() != Genome.LENGTH) return false;
        for (int i=0;i<Genome.LENGTH;i++) {
            double v = g.gene(i);
            if (!(v >= 0.0 && v <= 1.0)) return false;
            if (Double.doubleToRawLongBits(v) == Double.doubleToRawLongBits(-0.0)) return false;
        }
        for (int k=1;k<Genome.CUT_COUNT;k++) if (g.cut(k) < g.cut(k-1)) return false;
        return true;
    }
}
