package com.catalog.reconciliation.core.model;

import java.util.Locale;

/**
 * Coarse price-per-kg band.
 */
public enum PriceBucket {
    LOW,
    MID,
    HIGH;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
