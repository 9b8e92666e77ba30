package org.tesis.loteo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GeneticOperatorsTest {

    @Test
    void testRandomGenome_ValidAndSeeded() {
        Random a = new Random(11), b = new Random(11);
        for (int i=0;i<20;i++) {
            Genome g = GeneticOperators.randomGenome(a);
            assertTrue(GenomeRepair.isValid(g), g.toString());
            assertEquals(g, GeneticOperators.randomGenome(b));
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2})
    void testCrossover_ChildrenMixParents(int points) {
        Random rng = new Random(points);
        for (int t=0;t<30;t++) {
            Genome a = GeneticOperators.randomGenome(rng), b = GeneticOperators.randomGenome(rng);
            Genome[] kids = GeneticOperators.crossover(a, b, points, rng);
            assertEquals(2, kids.length);
            for (Genome k : kids) assertTrue(GenomeRepair.isValid(k));
            // el primer gen nunca se cruza
            assertEquals(a.gene(0), kids[0].gene(0));
            assertEquals(b.gene(0), kids[1].gene(0));
            for (int i=0;i<Genome.FIRST_CUT;i++) {
                boolean kept = kids[0].gene(i) == a.gene(i) && kids[1].gene(i) == b.gene(i);
                boolean swapped = kids[0].gene(i) == b.gene(i) && kids[1].gene(i) == a.gene(i);
                assertTrue(kept || swapped, "gen " + i);
            }
        }
    }

    @Test
    void testCrossover_IdenticalParents() {
        Genome g = GenomeRepair.canonical();
        Genome[] kids = GeneticOperators.crossover(g, g, 2, new Random(1));
        assertEquals(g, kids[0]);
        assertEquals(g, kids[1]);
    }

    @Test
    void testMutate_ChangesAtLeastOneGene() {
        Random rng = new Random(5);
        Genome g = GenomeRepair.canonical();
        for (int t=0;t<50;t++) {
            Genome m = GeneticOperators.mutate(g, 0.1, rng);
            assertTrue(GenomeRepair.isValid(m));
            assertNotEquals(g, m);
        }
    }

    @Test
    void testMutate_StaysInRangeWithLargeSigma() {
        Random rng = new Random(9);
        Genome g = GenomeRepair.canonical();
        for (int t=0;t<50;t++) {
            g = GeneticOperators.mutate(g, 5.0, rng);
            assertTrue(GenomeRepair.isValid(g), g.toString());
        }
    }

    @Test
    void testTournament_LargeKPicksBest() {
        List<FitnessVector> fs = List.of(
                ParetoSelectorTest.fv(3, 3, 3, 3),
                ParetoSelectorTest.fv(1, 1, 1, 1),
                ParetoSelectorTest.fv(4, 1, 1, 1),
                ParetoSelectorTest.fv(0, 0, 0, 0));
        Ranking rk = ParetoSelector.rank(fs);
        assertEquals(0, GeneticOperators.tournament(fs, rk, 60, new Random(2)));
        Random rng = new Random(3);
        for (int t=0;t<100;t++) {
            int w = GeneticOperators.tournament(fs, rk, 1, rng);
            assertTrue(w >= 0 && w < fs.size());
        }
    }
}
