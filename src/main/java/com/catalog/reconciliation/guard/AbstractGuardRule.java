package com.catalog.reconciliation.guard;

import com.catalog.reconciliation.core.model.CanonicalProduct;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Base for guards that judge each product on its own.
 */
public abstract class AbstractGuardRule implements GuardRule {

    @Override
    public List<GuardViolation> check(Collection<CanonicalProduct> products) {
        List<GuardViolation> violations = new ArrayList<>();
        for (CanonicalProduct product : products) {
            inspect(product).ifPresent(message ->
                    violations.add(new GuardViolation(getName(), product.getProductKey(), message)));
        }
        violations.sort(Comparator.comparing(GuardViolation::productKey));
        return violations;
    }

    /**
     * Violation message for {@code product}, or empty when it is clean.
     */
    protected abstract Optional<String> inspect(CanonicalProduct product);
}
