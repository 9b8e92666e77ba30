package org.tesis.loteo;

import java.util.List;
import java.util.Optional;

public record ConstraintReport(boolean feasible, List<Violation> violations, double softPenalty) {

    public ConstraintReport {
        violations = List.copyOf(violations);
    }

    public static ConstraintReport of(List<Violation> violations) {
        boolean feasible = true;
        double soft = 0;
        for (Violation v : violations) {
            if (v.isHard()) feasible = false;
            else soft += v.magnitude();
        }
        return new ConstraintReport(feasible, violations, soft);
    }

    public int hardCount() {
        int n = 0;
        for (Violation v : violations) if (v.isHard()) n++;
        return n;
    }

    public Optional<Violation> violation(String rule) {
        for (Violation v : violations) if (v.rule().equals(rule)) return Optional.of(v);
        return Optional.empty();
    }
}
