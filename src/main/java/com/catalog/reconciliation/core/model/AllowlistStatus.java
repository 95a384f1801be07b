package com.catalog.reconciliation.core.model;

/**
 * Promotion state of a brand in the production allowlist.
 */
public enum AllowlistStatus {
    ACTIVE,
    PENDING,
    PAUSED,
    REMOVED;

    /**
     * Only ACTIVE brands reach the production view.
     */
    public boolean isProductionEligible() {
        return this == ACTIVE;
    }
}
