package org.tesis.loteo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParetoSelectorTest {

    static FitnessVector fv(double... v) {
        return new FitnessVector(v.clone(), v.clone(), new boolean[FitnessVector.SIZE], ConstraintReport.of(List.of()));
    }

    // individuo con layout de 'lots' lotes y una vía de largo roadLength
    static Individual individual(FitnessVector f, int lots, double roadLength) {
        Boundary b = Boundary.of(Sites.rect(0, 0, 1000, 1000));
        List<Lot> ls = new ArrayList<>();
        for (int i=0;i<lots;i++) {
            Polygon p = Sites.rect(10 * i, 0, 10 * i + 8, 8);
            ls.add(new Lot(i, p, 8, 1, false, ZoneType.WAREHOUSE, 70));
        }
        Road r = new Road(0, GeomUtils.segment(Sites.GF, 0, 500, roadLength, 500), 10, RoadClass.PRIMARY,
                Sites.rect(0, 495, roadLength, 505));
        Layout l = new Layout(GenomeRepair.canonical(), b, ls, List.of(r), RoadNetwork.empty(), List.of());
        return new Individual(l.genome(), new Evaluation(l, f.report(), f));
    }

    // ========== Rangos ==========

    @Test
    void testRanks_SuccessiveFronts() {
        List<FitnessVector> fs = List.of(
                fv(3, 3, 3, 3),
                fv(1, 1, 1, 1),
                fv(4, 1, 1, 1),
                fv(0, 0, 0, 0));
        assertArrayEquals(new int[]{0, 1, 0, 2}, ParetoSelector.ranks(fs));
        assertEquals(3, ParetoSelector.rank(fs).frontCount());
    }

    @Test
    void testRanks_EqualVectorsShareFront() {
        List<FitnessVector> fs = List.of(fv(1, 2, 3, 4), fv(1, 2, 3, 4), fv(1, 2, 3, 4));
        assertArrayEquals(new int[]{0, 0, 0}, ParetoSelector.ranks(fs));
    }

    @Test
    void testCrowding_ExtremesAreInfinite() {
        List<FitnessVector> fs = List.of(
                fv(0, 4, 0, 0),
                fv(1, 3, 0, 0),
                fv(2, 2, 0, 0),
                fv(4, 0, 0, 0));
        double[] d = ParetoSelector.crowding(fs, ParetoSelector.ranks(fs));
        assertTrue(Double.isInfinite(d[0]));
        assertTrue(Double.isInfinite(d[3]));
        assertEquals(1.0, d[1], 1e-12);
        assertEquals(1.5, d[2], 1e-12);
    }

    @Test
    void testCrowding_SmallFrontsAreInfinite() {
        List<FitnessVector> fs = List.of(fv(1, 0, 0, 0), fv(0, 1, 0, 0));
        double[] d = ParetoSelector.crowding(fs, ParetoSelector.ranks(fs));
        assertTrue(Arrays.stream(d).allMatch(Double::isInfinite));
    }

    // ========== Recomendado ==========

    @Test
    @DisplayName("Empate financiero: menor largo de vías, luego más lotes, luego menor índice")
    void testRecommend_TieBreak() {
        FitnessVector f = fv(1, 1, 1, 5);
        Population pop = new Population(List.of(
                individual(f, 2, 100),
                individual(f, 1, 50),
                individual(f, 3, 50),
                individual(f, 3, 50)), 4);
        ParetoFront front = ParetoSelector.front(pop);
        assertEquals(4, front.size());
        assertSame(pop.get(2), front.recommended());
        assertEquals(4, front.generation());
    }

    @Test
    void testRecommend_HighestFinancialWins() {
        Population pop = new Population(List.of(
                individual(fv(1, 1, 1, 5), 5, 10),
                individual(fv(0, 1, 1, 6), 1, 900),
                individual(fv(0, 0, 0, 0), 9, 1)), 0);
        ParetoFront front = ParetoSelector.front(pop);
        assertEquals(2, front.size());
        assertSame(pop.get(1), front.recommended());
        assertEquals(6.0, front.bestFinancial());
        assertEquals(2, front.feasibleCount());
    }

    @Test
    void testFront_EmptyPopulation() {
        ParetoFront front = ParetoSelector.front(new Population(List.of(), 0));
        assertEquals(0, front.size());
        assertNull(front.recommended());
    }

    // ========== Torneo y élites ==========

    @Test
    void testCompareForTournament() {
        List<FitnessVector> fs = List.of(
                fv(3, 3, 3, 3),
                fv(1, 1, 1, 1),
                fv(4, 1, 1, 1),
                fv(0, 0, 0, 0));
        Ranking rk = ParetoSelector.rank(fs);
        assertTrue(ParetoSelector.compareForTournament(0, 1, fs, rk) < 0);
        assertTrue(ParetoSelector.compareForTournament(3, 1, fs, rk) > 0);
        // mismo frente, hacinamiento infinito en ambos: decide el objetivo financiero
        assertTrue(ParetoSelector.compareForTournament(0, 2, fs, rk) < 0);
        assertEquals(0, ParetoSelector.compareForTournament(1, 1, fs, rk));
    }

    @Test
    void testElites_ByFinancialDescending() {
        List<FitnessVector> fs = List.of(
                fv(5, 0, 0, 1),
                fv(0, 0, 0, 0),
                fv(0, 5, 0, 3),
                fv(0, 0, 5, 2));
        Ranking rk = ParetoSelector.rank(fs);
        assertEquals(List.of(2, 3), ParetoSelector.elites(fs, rk, 2));
        assertEquals(List.of(2, 3, 0), ParetoSelector.elites(fs, rk, 10));
    }
}
