package org.tesis.loteo;

import java.util.List;

public final class ParetoFront {

    private final List<Individual> members;
    private final Individual recommended;
    private final int generation;

    ParetoFront(List<Individual> members, Individual recommended, int generation) {
        this.members = List.copyOf(members);
        this.recommended = recommended;
        this.generation = generation;
    }

    public List<Individual> members()   { return members; }
    public Individual recommended()     { return recommended; }
    public int generation()             { return generation; }
    public int size()                   { return members.size(); }

    public long feasibleCount() {
        return members.stream().filter(i -> i.fitness().feasible()).count();
    }

    public double bestFinancial() {
        double best = Double.NEGATIVE_INFINITY;
        for (Individual i : members) best = Math.max(best, i.fitness().financial());
        return best;
    }
}
