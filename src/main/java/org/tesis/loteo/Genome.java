package org.tesis.loteo;

import java.util.Arrays;
import java.util.Locale;

/**
 * Genoma de estructura fija: 16 valores normalizados en [0,1]. Es la única representación
 * sobre la que operan cruce y mutación. Inmutable; igualdad por valor (clave de memoización).
 *
 * <pre>
 *  0 PRIMARY_OFFSET  posición transversal de la vía principal
 *  1 PRIMARY_ANGLE   giro respecto del eje largo (banda muerta central = 0°)
 *  2 BLOCK_SPACING   largo máximo de manzana entre vías secundarias
 *  3 LOT_WIDTH       frente objetivo del lote
 *  4 LOT_ASPECT      proporción fondo/frente dentro del rango permitido
 *  5 LOCAL_ROADS     >= 0.5 habilita vías locales y franjas dobles
 *  6 GREEN_CAP       calidad máxima de lote convertible en área verde
 *  7 ZONE_MIX        umbral de área entre depósitos y fábricas
 *  8..15 CUT_*       cortes preferidos de vías secundarias, ascendentes
 * </pre>
 */
public final class Genome {

    static final int PRIMARY_OFFSET = 0;
    static final int PRIMARY_ANGLE  = 1;
    static final int BLOCK_SPACING  = 2;
    static final int LOT_WIDTH      = 3;
    static final int LOT_ASPECT     = 4;
    static final int LOCAL_ROADS    = 5;
    static final int GREEN_CAP      = 6;
    static final int ZONE_MIX       = 7;
    static final int FIRST_CUT      = 8;
    static final int CUT_COUNT      = 8;
    static final int LENGTH         = FIRST_CUT + CUT_COUNT;

    private final double[] genes;
    private final int hash;

    private Genome(double[] genes) {
        this.genes = genes;
        this.hash = Arrays.hashCode(genes);
    }

    // crea un genoma sin reparar (puede estar fuera de rango); el motor siempre lo pasa por GenomeRepair
    public static Genome of(double... genes) {
        return new Genome(genes.clone());
    }

    static Genome wrap(double[] owned) {
        return new Genome(owned);
    }

    public int length() {
        return genes.length;
    }

    public double gene(int i) {
        return genes[i];
    }

    public double[] toArray() {
        return genes.clone();
    }

    double cut(int k) {
        return genes[FIRST_CUT + k];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Genome g)) return false;
        return hash == g.hash && Arrays.equals(genes, g.genes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Genome[");
        for (int i=0;i<genes.length;i++) {
            if (i > 0) sb.append(' ');
            sb.append(String.format(Locale.US, "%.3f", genes[i]));
        }
        return sb.append(']').toString();
    }
}
