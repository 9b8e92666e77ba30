package org.tesis.loteo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Calcula el vector de objetivos de un layout consultando los oráculos.
 *
 * Castigo por construcción: un objetivo factible se acota a [-VALUE_BOUND, VALUE_BOUND]; uno
 * infactible además se desplaza en -INFEASIBLE_OFFSET y baja PENALTY_PER_UNIT por cada
 * incumplimiento duro y por unidad de castigo blando. Así todo vector infactible queda dominado
 * por cualquier factible y los infactibles siguen siendo comparables entre sí.
 *
 * Un oráculo que falla deja WORST_SCORE en el objetivo financiero de ese individuo, sea o no
 * factible; la falla se cuenta.
 */
public class FitnessEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FitnessEvaluator.class);

    static final double WORST_SCORE       = -1e12;
    static final double VALUE_BOUND       = 1e6;
    static final double INFEASIBLE_OFFSET = 1e7;
    static final double PENALTY_PER_UNIT  = 1e4;

    private final Oracles oracles;
    private final AtomicLong failures = new AtomicLong();

    public FitnessEvaluator(Oracles oracles) {
        this.oracles = oracles;
    }

    public Oracles oracles() {
        return oracles;
    }

    public long oracleFailures() {
        return failures.get();
    }

    // terreno del layout, o null si no hay oráculo o si falló (la falla queda contada)
    public TerrainScore terrain(Layout layout) {
        if (!oracles.hasTerrain()) return null;
        try {
            TerrainScore t = oracles.terrain().score(layout);
            if (t == null) throw new OracleException("El oráculo de terreno devolvió null");
            return t;
        } catch (RuntimeException e) {
            recordFailure("terreno", e);
            return null;
        }
    }

    public FitnessVector evaluate(Layout layout, ConstraintReport report) {
        return evaluate(layout, report, terrain(layout));
    }

    public FitnessVector evaluate(Layout layout, ConstraintReport report, TerrainScore terrain) {
        double[] raw = new double[FitnessVector.SIZE];
        boolean[] failed = new boolean[FitnessVector.SIZE];

        raw[FitnessVector.LOT_COUNT] = layout.lotCount();
        raw[FitnessVector.MEAN_QUALITY] = layout.meanQuality();
        double roadArea = layout.roadArea();
        raw[FitnessVector.ROAD_EFFICIENCY] = roadArea > GeomUtils.AREA_EPS ? layout.sellableArea() / roadArea : 0.0;

        // un terreno pedido y no obtenido invalida el costo total
        if (oracles.hasTerrain() && terrain == null) {
            failed[FitnessVector.FINANCIAL] = true;
        } else {
            try {
                raw[FitnessVector.FINANCIAL] = financial(layout, terrain);
            } catch (RuntimeException e) {
                recordFailure("financiero", e);
                failed[FitnessVector.FINANCIAL] = true;
            }
        }

        double[] values = new double[FitnessVector.SIZE];
        double penalty = report.hardCount() + report.softPenalty();
        for (int i=0;i<FitnessVector.SIZE;i++) {
            if (failed[i]) {
                raw[i] = Double.NaN;
                values[i] = WORST_SCORE;
            } else {
                values[i] = penalize(raw[i], report.feasible(), penalty);
            }
        }
        return new FitnessVector(values, raw, failed, report);
    }

    double financial(Layout layout, TerrainScore terrain) {
        FinancialScore fs = oracles.financial().score(layout);
        if (fs == null) throw new OracleException("El oráculo financiero devolvió null");
        double extra = 0;
        if (oracles.hasUtility()) {
            UtilityScore u = oracles.utility().score(layout.lots(), layout.roads());
            if (u == null) throw new OracleException("El oráculo de redes devolvió null");
            extra += u.networkCost();
        }
        if (terrain != null) extra += terrain.gradingCost();
        double roi = extra == 0 ? fs.roiPercentage() : fs.plusCost(extra).roiPercentage();
        if (!Double.isFinite(roi)) throw new OracleException("ROI no finito: " + roi);
        return roi;
    }

    static double penalize(double raw, boolean feasible, double penalty) {
        double v = Math.max(-VALUE_BOUND, Math.min(VALUE_BOUND, raw));
        if (feasible) return v;
        return Math.max(WORST_SCORE / 2, v - INFEASIBLE_OFFSET - PENALTY_PER_UNIT * penalty);
    }

    void recordFailure(String oracle, RuntimeException e) {
        long n = failures.incrementAndGet();
        if (n == 1) log.warn("Falla del oráculo {}: {}", oracle, e.toString());
        else log.debug("Falla del oráculo {} (#{}): {}", oracle, n, e.toString());
    }
}
