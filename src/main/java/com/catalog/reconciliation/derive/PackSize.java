package com.catalog.reconciliation.derive;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A parsed pack size.
 *
 * @param grams     total net weight in grams
 * @param multipack whether the text described several units ({@code 12 x 85g})
 * @param display   the original text
 */
public record PackSize(BigDecimal grams, boolean multipack, String display) {

    public PackSize {
        Objects.requireNonNull(grams, "grams is required");
        if (grams.signum() <= 0) {
            throw new IllegalArgumentException("grams must be positive: " + grams);
        }
    }
}
