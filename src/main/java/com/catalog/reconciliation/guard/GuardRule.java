package com.catalog.reconciliation.guard;

import com.catalog.reconciliation.core.model.CanonicalProduct;

import java.util.Collection;
import java.util.List;

/**
 * Read-only predicate over a product set. Implementations must be pure so they can
 * run against a staged set while a run is still in progress.
 */
public interface GuardRule {

    /**
     * Stable name used in the guard report.
     */
    String getName();

    /**
     * Every violation in {@code products}, in product-key order.
     */
    List<GuardViolation> check(Collection<CanonicalProduct> products);
}
