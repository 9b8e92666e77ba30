package org.tesis.loteo;

// la evaluación se asigna una sola vez; los élites pasan de generación como el mismo objeto
public final class Individual {

    private final Genome genome;
    private volatile Evaluation evaluation;

    Individual(Genome genome) {
        this.genome = genome;
    }

    Individual(Genome genome, Evaluation evaluation) {
        this.genome = genome;
        this.evaluation = evaluation;
    }

    public Genome genome()           { return genome; }
    public Evaluation evaluation()   { return evaluation; }
    public boolean isEvaluated()     { return evaluation != null; }

    void evaluation(Evaluation e) {
        if (evaluation != null) throw new IllegalStateException("Individuo ya evaluado");
        evaluation = e;
    }

    public Layout layout()           { return require().layout(); }
    public FitnessVector fitness()   { return require().fitness(); }
    public ConstraintReport report() { return require().report(); }

    private Evaluation require() {
        Evaluation e = evaluation;
        if (e == null) throw new IllegalStateException("Individuo sin evaluar: " + genome);
        return e;
    }

    @Override
    public String toString() {
        return "Individual{" + genome + (evaluation != null ? ", " + evaluation.fitness() : "") + "}";
    }
}
