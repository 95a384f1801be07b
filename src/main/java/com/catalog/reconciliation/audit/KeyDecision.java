package com.catalog.reconciliation.audit;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of the {@link KeyDecisionLog}.
 *
 * @param productKey base product key (without collision suffix)
 * @param type       merge or split
 * @param decidedBy  reviewer id
 * @param notes      free-text justification
 * @param decidedAt  when the decision was taken
 */
public record KeyDecision(String productKey, KeyDecisionType type, String decidedBy,
                          String notes, Instant decidedAt) {

    public KeyDecision {
        Objects.requireNonNull(productKey, "productKey is required");
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(decidedAt, "decidedAt is required");
    }
}
