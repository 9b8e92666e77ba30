package org.tesis.loteo;

import java.util.List;

// salida de una corrida: frente, población final (para reanudar) y estadísticas
public final class OptimizationResult {

    private final ParetoFront front;
    private final Population finalPopulation;
    private final int generations;
    private final TerminationReason reason;
    private final List<Double> bestFinancialHistory;
    private final long oracleFailures;
    private final long evaluations;
    private final long elapsedMillis;

    OptimizationResult(ParetoFront front, Population finalPopulation, int generations, TerminationReason reason,
                       List<Double> bestFinancialHistory, long oracleFailures, long evaluations, long elapsedMillis) {
        this.front = front;
        this.finalPopulation = finalPopulation;
        this.generations = generations;
        this.reason = reason;
        this.bestFinancialHistory = List.copyOf(bestFinancialHistory);
        this.oracleFailures = oracleFailures;
        this.evaluations = evaluations;
        this.elapsedMillis = elapsedMillis;
    }

    public ParetoFront front()                  { return front; }
    public Individual recommended()             { return front.recommended(); }
    public Layout recommendedLayout()           { return front.recommended().layout(); }
    public FitnessVector recommendedFitness()   { return front.recommended().fitness(); }
    public ConstraintReport recommendedReport() { return front.recommended().report(); }
    public Population finalPopulation()         { return finalPopulation; }
    public int generations()                    { return generations; }
    public TerminationReason reason()           { return reason; }
    public long oracleFailures()                { return oracleFailures; }
    public long evaluations()                   { return evaluations; }
    public long elapsedMillis()                 { return elapsedMillis; }

    // mejor objetivo financiero del frente; índice 0 = población inicial
    public List<Double> bestFinancialHistory()  { return bestFinancialHistory; }

    // false si ningún miembro del frente cumple las restricciones duras
    public boolean converged() {
        return front.feasibleCount() > 0;
    }
}
