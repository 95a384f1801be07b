package com.catalog.reconciliation.merge;

/**
 * Named strategies a field value can come from, listed in a field's precedence chain.
 */
public enum ResolutionStep {
    /**
     * A non-null value from a manually authored override.
     */
    OVERRIDE("override"),
    /**
     * The value of the highest-ranked record of the group.
     */
    BEST_SCORED_BASE("best-scored-merge"),
    /**
     * The first non-null value among all records, in rank order.
     */
    BEST_AVAILABLE("best-available"),
    /**
     * The union of the values of all records.
     */
    UNION_ALL("union"),
    /**
     * Computed from other fields of the product.
     */
    DERIVED("derived-default");

    private final String label;

    ResolutionStep(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
