package org.tesis.loteo;

// resultado completo de evaluar un genoma
public record Evaluation(Layout layout, ConstraintReport report, FitnessVector fitness) {
}
