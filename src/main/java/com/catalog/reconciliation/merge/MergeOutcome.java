package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.ReconciliationIssue;

import java.util.List;

/**
 * Staged result of the merge stage.
 *
 * @param products   merged products sorted by product key
 * @param collisions key collisions found while clustering
 * @param issues     recoverable issues raised while preparing records
 * @param recordsRead number of raw records fed into the stage
 */
public record MergeOutcome(List<CanonicalProduct> products, List<KeyCollision> collisions,
                           List<ReconciliationIssue> issues, int recordsRead) {

    public MergeOutcome {
        products = List.copyOf(products);
        collisions = List.copyOf(collisions);
        issues = List.copyOf(issues);
    }
}
