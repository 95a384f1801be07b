package com.catalog.reconciliation.rules;

/**
 * How much pack-size text the name slug drops.
 */
public enum PackSizeStripping {
    /**
     * Drop multipack and pack-count tokens ({@code 12x85g}, {@code 6 pack});
     * a single weight ({@code 15kg}) stays part of the name.
     */
    MULTIPACK_ONLY,
    /**
     * Drop every numeric quantity with a unit.
     */
    ALL
}
