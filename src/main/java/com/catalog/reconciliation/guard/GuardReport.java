package com.catalog.reconciliation.guard;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Results of every guard over a staged set, in guard order. A set may only be
 * promoted to production when {@link #passed()}.
 */
public record GuardReport(List<GuardResult> results) {

    public GuardReport {
        results = List.copyOf(results);
    }

    public boolean passed() {
        return results.stream().allMatch(GuardResult::passed);
    }

    public int totalViolations() {
        return results.stream().mapToInt(GuardResult::violationCount).sum();
    }

    public Optional<GuardResult> resultFor(String guardName) {
        return results.stream().filter(r -> r.guardName().equals(guardName)).findFirst();
    }

    public Set<String> violatingProductKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (GuardResult result : results) {
            for (GuardViolation violation : result.violations()) {
                keys.add(violation.productKey());
            }
        }
        return keys;
    }
}
