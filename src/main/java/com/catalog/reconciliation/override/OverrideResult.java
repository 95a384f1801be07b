package com.catalog.reconciliation.override;

import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.ReconciliationIssue;

import java.util.List;

/**
 * Products after overrides, with the overrides that could not be applied.
 *
 * @param products        products in input order
 * @param issues          OVERRIDE_CONFLICT issues for overrides whose target is gone
 * @param appliedCount    number of override applications
 */
public record OverrideResult(List<CanonicalProduct> products, List<ReconciliationIssue> issues, int appliedCount) {

    public OverrideResult {
        products = List.copyOf(products);
        issues = List.copyOf(issues);
    }
}
