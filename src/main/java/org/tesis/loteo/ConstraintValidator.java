package org.tesis.loteo;

import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Contrasta un layout con todas las reglas del conjunto. No modifica el layout.
 */
public class ConstraintValidator {

    private final ConstraintSet constraints;

    public ConstraintValidator(ConstraintSet constraints) {
        this.constraints = constraints;
    }

    public ConstraintSet constraints() {
        return constraints;
    }

    public ConstraintReport validate(Layout layout) {
        return validate(layout, null);
    }

    // terrain puede ser null: en ese caso max_slope no se evalúa
    public ConstraintReport validate(Layout layout, TerrainScore terrain) {
        List<Violation> out = new ArrayList<>();
        for (Map.Entry<String, Rule> e : constraints.rules().entrySet()) {
            String name = e.getKey();
            Rule rule = e.getValue();
            switch (name) {
                case ConstraintSet.MIN_LOT_SIZE:
                case ConstraintSet.MAX_LOT_SIZE:
                    perLot(name, rule, layout, Lot::area, out);
                    break;
                case ConstraintSet.MIN_FRONTAGE:
                    perLot(name, rule, layout, Lot::frontage, out);
                    break;
                case ConstraintSet.LOT_ASPECT_RATIO:
                    perLot(name, rule, layout, Lot::aspectRatio, out);
                    break;
                case ConstraintSet.GREEN_SPACE_RATIO:
                    single(name, rule, layout.greenRatio(), 1, out);
                    break;
                case ConstraintSet.BUFFER_WIDTH:
                    single(name, rule, bufferDistance(layout), 1, out);
                    break;
                case ConstraintSet.ROAD_WIDTH:
                    if (!layout.roads().isEmpty()) single(name, rule, narrowest(layout, null), 1, out);
                    break;
                case ConstraintSet.PRIMARY_ROAD_WIDTH:
                    single(name, rule, narrowest(layout, RoadClass.PRIMARY), 1, out);
                    break;
                case ConstraintSet.LOT_COUNT:
                    single(name, rule, layout.lotCount(), 1, out);
                    break;
                case ConstraintSet.ROAD_AREA_RATIO:
                    single(name, rule, layout.roadArea() / layout.boundary().area(), 1, out);
                    break;
                case ConstraintSet.MAX_SLOPE:
                    if (terrain != null) {
                        single(name, rule, terrain.maxSlopePercent(), Math.max(1, terrain.slopeViolations()), out);
                    }
                    break;
                default:
                    throw new IllegalStateException("Regla sin validación: " + name);
            }
        }
        return ConstraintReport.of(out);
    }

    // una sola entrada por regla: peor valor y cantidad de lotes que fallan
    static void perLot(String name, Rule rule, Layout layout, ToDoubleFunction<Lot> metric, List<Violation> out) {
        int count = 0;
        double worst = Double.NaN, worstGap = -1;
        for (Lot l : layout.lots()) {
            double v = metric.applyAsDouble(l);
            double gap = rule.shortfall(v);
            if (gap == 0.0) continue;
            count++;
            if (gap > worstGap) { worstGap = gap; worst = v; }
        }
        if (count > 0) out.add(new Violation(name, worst, rule, rule.magnitude(worst), count));
    }

    static void single(String name, Rule rule, double actual, int count, List<Violation> out) {
        if (!rule.test(actual)) out.add(new Violation(name, actual, rule, rule.magnitude(actual), count));
    }

    // distancia mínima entre el borde del predio y cualquier lote o vía (infinita si no hay ninguno)
    static double bufferDistance(Layout layout) {
        Geometry ring = layout.boundary().shared().getBoundary();
        double min = Double.POSITIVE_INFINITY;
        for (Lot l : layout.lots()) min = Math.min(min, ring.distance(l.shared()));
        for (Road r : layout.roads()) min = Math.min(min, ring.distance(r.sharedFootprint()));
        return min;
    }

    // ancho de la vía más angosta de la clase dada (todas si cls es null); 0 si no hay ninguna
    static double narrowest(Layout layout, RoadClass cls) {
        double min = Double.POSITIVE_INFINITY;
        for (Road r : layout.roads()) {
            if (cls == null || r.roadClass() == cls) min = Math.min(min, r.width());
        }
        return Double.isInfinite(min) ? 0.0 : min;
    }
}
