package com.catalog.reconciliation.override;

/**
 * What an override targets.
 */
public enum OverrideScope {
    /** One product, by product key. */
    PRODUCT_KEY,
    /** Every product of a brand, by brand slug. */
    BRAND_SLUG
}
