package org.tesis.loteo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GenomeRepairTest {

    // ========== Normalización ==========

    @Test
    @DisplayName("NaN pasa a 0.5, infinitos y fuera de rango se recortan, -0.0 queda en 0.0")
    void testRepair_SpecialValues() {
        double[] raw = new double[Genome.LENGTH];
        Arrays.fill(raw, 0.25);
        raw[0] = Double.NaN;
        raw[1] = Double.POSITIVE_INFINITY;
        raw[2] = Double.NEGATIVE_INFINITY;
        raw[3] = -0.0;
        raw[4] = 7.5;
        raw[5] = -3.0;

        Genome g = GenomeRepair.repair(raw);

        assertEquals(0.5, g.gene(0));
        assertEquals(1.0, g.gene(1));
        assertEquals(0.0, g.gene(2));
        assertEquals(Double.doubleToRawLongBits(0.0), Double.doubleToRawLongBits(g.gene(3)));
        assertEquals(1.0, g.gene(4));
        assertEquals(0.0, g.gene(5));
        assertTrue(GenomeRepair.isValid(g));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 7, 15, 16, 17, 40})
    void testRepair_AnyLengthBecomesSixteen(int length) {
        double[] raw = new double[length];
        for (int i=0;i<length;i++) raw[i] = 0.1;
        Genome g = GenomeRepair.repair(raw);
        assertEquals(Genome.LENGTH, g.length());
        for (int i=length;i<Genome.LENGTH;i++) assertEquals(0.5, g.gene(i), "gen de relleno " + i);
        assertTrue(GenomeRepair.isValid(g));
    }

    @Test
    void testRepair_NullInputs() {
        assertEquals(GenomeRepair.canonical(), GenomeRepair.repair((Genome) null));
        Genome padded = GenomeRepair.repair((double[]) null);
        for (int i=0;i<Genome.LENGTH;i++) assertEquals(0.5, padded.gene(i));
    }

    @Test
    void testRepair_CutsSortedAscending() {
        double[] raw = GenomeRepair.canonical().toArray();
        for (int k=0;k<Genome.CUT_COUNT;k++) raw[Genome.FIRST_CUT + k] = 1.0 - k / 10.0;
        Genome g = GenomeRepair.repair(raw);
        for (int k=1;k<Genome.CUT_COUNT;k++) assertTrue(g.cut(k) >= g.cut(k-1));
        assertEquals(0.3, g.cut(0), 1e-12);
        assertEquals(1.0, g.cut(Genome.CUT_COUNT - 1), 1e-12);
    }

    // ========== Idempotencia ==========

    @Test
    @DisplayName("repair(repair(g)) == repair(g) para genomas arbitrarios")
    void testRepair_Idempotent() {
        Random rng = new Random(11);
        for (int t=0;t<500;t++) {
            double[] raw = new double[rng.nextInt(24)];
            for (int i=0;i<raw.length;i++) {
                switch (rng.nextInt(6)) {
                    case 0: raw[i] = Double.NaN; break;
                    case 1: raw[i] = rng.nextBoolean() ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY; break;
                    case 2: raw[i] = -0.0; break;
                    default: raw[i] = rng.nextGaussian() * 2;
                }
            }
            Genome once = GenomeRepair.repair(raw);
            assertEquals(once, GenomeRepair.repair(once));
            assertTrue(GenomeRepair.isValid(once));
        }
    }

    @Test
    void testGenome_EqualityByValue() {
        Genome a = Genome.of(GenomeRepair.canonical().toArray());
        Genome b = GenomeRepair.canonical();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        double[] arr = a.toArray();
        arr[0] = 0.9;
        assertEquals(0.5, a.gene(0), "el genoma no expone su arreglo interno");
    }
}
