package com.catalog.reconciliation.guard;

import java.util.List;

/**
 * Outcome of one guard over one product set.
 */
public record GuardResult(String guardName, List<GuardViolation> violations) {

    public GuardResult {
        violations = List.copyOf(violations);
    }

    public int violationCount() {
        return violations.size();
    }

    public boolean passed() {
        return violations.isEmpty();
    }

    /**
     * The first {@code size} violations.
     */
    public List<GuardViolation> sample(int size) {
        return violations.subList(0, Math.min(size, violations.size()));
    }
}
