package com.catalog.reconciliation.audit;

/**
 * Human decision on a product key shared by records that looked like different products.
 */
public enum KeyDecisionType {
    /**
     * The records are one product; future runs merge them under the base key.
     */
    MERGE,
    /**
     * The records are different products; suffixed keys are permanent.
     */
    SPLIT
}
