package org.tesis.loteo;

import java.util.ArrayList;
import java.util.List;

// individuos de una generación, en orden; solo el motor la reemplaza entre generaciones
public final class Population {

    private final List<Individual> members;
    private final int generation;

    Population(List<Individual> members, int generation) {
        this.members = List.copyOf(members);
        this.generation = generation;
    }

    public List<Individual> members()  { return members; }
    public int generation()            { return generation; }
    public int size()                  { return members.size(); }
    public Individual get(int i)       { return members.get(i); }

    List<FitnessVector> fitness() {
        List<FitnessVector> out = new ArrayList<>(members.size());
        for (Individual i : members) out.add(i.fitness());
        return out;
    }
}
