package com.catalog.reconciliation.core.model;

/**
 * The two read views consumers can query.
 */
public enum CatalogView {
    /** Every canonicalized product, whatever its brand's allowlist state. */
    PREVIEW,
    /** Products of ACTIVE brands that pass every guard. */
    PRODUCTION
}
