package org.tesis.loteo;

import java.util.*;

/**
 * Ordenamiento no dominado, distancia de hacinamiento y elección del layout recomendado.
 *
 * Recomendado: mayor objetivo financiero, luego menor largo total de vías, luego más lotes,
 * luego menor posición en la población.
 */
public final class ParetoSelector {

    private ParetoSelector() {
    }

    public static Ranking rank(List<FitnessVector> fs) {
        int[] rank = ranks(fs);
        return new Ranking(rank, crowding(fs, rank));
    }

    // rango por frentes sucesivos (0 = no dominado)
    static int[] ranks(List<FitnessVector> fs) {
        int n = fs.size();
        int[] rank = new int[n];
        int[] dominatedBy = new int[n];
        List<List<Integer>> dominates = new ArrayList<>(n);
        for (int i=0;i<n;i++) dominates.add(new ArrayList<>());
        for (int i=0;i<n;i++) {
            for (int j=i+1;j<n;j++) {
                if (fs.get(i).dominates(fs.get(j))) { dominates.get(i).add(j); dominatedBy[j]++; }
                else if (fs.get(j).dominates(fs.get(i))) { dominates.get(j).add(i); dominatedBy[i]++; }
            }
        }
        List<Integer> current = new ArrayList<>();
        for (int i=0;i<n;i++) if (dominatedBy[i] == 0) current.add(i);
        int r = 0;
        while (!current.isEmpty()) {
            List<Integer> next = new ArrayList<>();
            for (int i : current) {
                rank[i] = r;
                for (int j : dominates.get(i)) if (--dominatedBy[j] == 0) next.add(j);
            }
            current = next;
            r++;
        }
        return rank;
    }

    // distancia de hacinamiento dentro de cada frente; extremos = infinito
    static double[] crowding(List<FitnessVector> fs, int[] rank) {
        int n = fs.size();
        double[] dist = new double[n];
        Map<Integer, List<Integer>> fronts = new TreeMap<>();
        for (int i=0;i<n;i++) fronts.computeIfAbsent(rank[i], k -> new ArrayList<>()).add(i);
        for (List<Integer> front : fronts.values()) {
            if (front.size() <= 2) {
                for (int i : front) dist[i] = Double.POSITIVE_INFINITY;
                continue;
            }
            for (int m=0;m<FitnessVector.SIZE;m++) {
                final int obj = m;
                List<Integer> s = new ArrayList<>(front);
                s.sort(Comparator.comparingDouble((Integer i) -> fs.get(i).value(obj)).thenComparingInt(i -> i));
                double lo = fs.get(s.get(0)).value(obj), hi = fs.get(s.get(s.size()-1)).value(obj);
                dist[s.get(0)] = Double.POSITIVE_INFINITY;
                dist[s.get(s.size()-1)] = Double.POSITIVE_INFINITY;
                if (hi <= lo) continue;
                for (int k=1;k<s.size()-1;k++) {
                    int i = s.get(k);
                    if (Double.isInfinite(dist[i])) continue;
                    dist[i] += (fs.get(s.get(k+1)).value(obj) - fs.get(s.get(k-1)).value(obj)) / (hi - lo);
                }
            }
        }
        return dist;
    }

    public static ParetoFront front(Population pop) {
        Ranking rk = rank(pop.fitness());
        return front(pop, rk);
    }

    static ParetoFront front(Population pop, Ranking rk) {
        List<Individual> members = new ArrayList<>();
        for (int i=0;i<pop.size();i++) if (rk.rank(i) == 0) members.add(pop.get(i));
        int rec = recommend(pop, rk);
        return new ParetoFront(members, rec < 0 ? null : pop.get(rec), pop.generation());
    }

    // índice del recomendado dentro de la población (-1 si está vacía)
    static int recommend(Population pop, Ranking rk) {
        int best = -1;
        for (int i=0;i<pop.size();i++) {
            if (rk.rank(i) != 0) continue;
            if (best < 0 || preferred(pop.get(i), pop.get(best))) best = i;
        }
        return best;
    }

    // a antes que b según el desempate del recomendado (b tiene menor índice)
    static boolean preferred(Individual a, Individual b) {
        int c = Double.compare(a.fitness().financial(), b.fitness().financial());
        if (c != 0) return c > 0;
        c = Double.compare(b.layout().totalRoadLength(), a.layout().totalRoadLength());
        if (c != 0) return c > 0;
        return a.layout().lotCount() > b.layout().lotCount();
    }

    /**
     * Torneo: dominancia, luego rango, luego hacinamiento, luego objetivo financiero, luego índice.
     * Devuelve negativo si i gana sobre j.
     */
    static int compareForTournament(int i, int j, List<FitnessVector> fs, Ranking rk) {
        if (fs.get(i).dominates(fs.get(j))) return -1;
        if (fs.get(j).dominates(fs.get(i))) return 1;
        int c = Integer.compare(rk.rank(i), rk.rank(j));
        if (c != 0) return c;
        c = Double.compare(rk.crowding(j), rk.crowding(i));
        if (c != 0) return c;
        c = Double.compare(fs.get(j).financial(), fs.get(i).financial());
        if (c != 0) return c;
        return Integer.compare(i, j);
    }

    // élites: frente ordenado por objetivo financiero desc, luego hacinamiento desc, luego índice
    static List<Integer> elites(List<FitnessVector> fs, Ranking rk, int count) {
        List<Integer> front = new ArrayList<>();
        for (int i=0;i<fs.size();i++) if (rk.rank(i) == 0) front.add(i);
        front.sort((a, b) -> {
            int c = Double.compare(fs.get(b).financial(), fs.get(a).financial());
            if (c != 0) return c;
            c = Double.compare(rk.crowding(b), rk.crowding(a));
            return c != 0 ? c : Integer.compare(a, b);
        });
        return front.subList(0, Math.min(count, front.size()));
    }
}
