package org.tesis.loteo;

import java.util.List;
import java.util.Random;

// todos reciben el Random del motor y devuelven genomas reparados
final class GeneticOperators {

    private GeneticOperators() {
    }

    static Genome randomGenome(Random rng) {
        double[] g = new double[Genome.LENGTH];
        for (int i=0;i<g.length;i++) g[i] = rng.nextDouble();
        return GenomeRepair.repair(g);
    }

    // cruce de 1 o 2 puntos; devuelve los dos hijos
    static Genome[] crossover(Genome a, Genome b, int points, Random rng) {
        double[] pa = a.toArray(), pb = b.toArray();
        int n = pa.length;
        int c1 = 1 + rng.nextInt(n - 1);
        int c2 = n;
        if (points >= 2) {
            int x = 1 + rng.nextInt(n - 1);
            c2 = Math.max(c1, x);
            c1 = Math.min(c1, x);
        }
        double[] h1 = pa.clone(), h2 = pb.clone();
        for (int i=c1;i<c2;i++) {
            h1[i] = pb[i];
            h2[i] = pa[i];
        }
        return new Genome[]{ GenomeRepair.repair(h1), GenomeRepair.repair(h2) };
    }

    // perturbación gaussiana: cada gen con prob 1/L, al menos uno
    static Genome mutate(Genome g, double sigma, Random rng) {
        double[] x = g.toArray();
        boolean any = false;
        for (int i=0;i<x.length;i++) {
            if (rng.nextDouble() < 1.0 / x.length) {
                x[i] += rng.nextGaussian() * sigma;
                any = true;
            }
        }
        if (!any) {
            int i = rng.nextInt(x.length);
            x[i] += rng.nextGaussian() * sigma;
        }
        return GenomeRepair.repair(x);
    }

    // torneo de tamaño k con reemplazo; gana el mejor según ParetoSelector.compareForTournament
    static int tournament(List<FitnessVector> fs, Ranking rk, int k, Random rng) {
        int best = rng.nextInt(fs.size());
        for (int t=1;t<k;t++) {
            int c = rng.nextInt(fs.size());
            if (ParetoSelector.compareForTournament(c, best, fs, rk) < 0) best = c;
        }
        return best;
    }
}
