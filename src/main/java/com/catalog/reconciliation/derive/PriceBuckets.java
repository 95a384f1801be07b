package com.catalog.reconciliation.derive;

import com.catalog.reconciliation.core.model.PriceBucket;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Price-per-kg thresholds: below {@code lowBelow} is LOW, above {@code highAbove}
 * is HIGH, anything in between (both bounds inclusive) is MID.
 *
 * @param lowBelow  exclusive upper bound of the LOW band
 * @param highAbove exclusive lower bound of the HIGH band
 */
public record PriceBuckets(BigDecimal lowBelow, BigDecimal highAbove) {

    public PriceBuckets {
        Objects.requireNonNull(lowBelow, "lowBelow is required");
        Objects.requireNonNull(highAbove, "highAbove is required");
        if (lowBelow.compareTo(highAbove) > 0) {
            throw new IllegalArgumentException("lowBelow must not exceed highAbove");
        }
    }

    public static PriceBuckets defaults() {
        return new PriceBuckets(new BigDecimal("5"), new BigDecimal("15"));
    }

    public PriceBucket bucketOf(BigDecimal pricePerKg) {
        Objects.requireNonNull(pricePerKg, "pricePerKg is required");
        if (pricePerKg.compareTo(lowBelow) < 0) {
            return PriceBucket.LOW;
        }
        if (pricePerKg.compareTo(highAbove) > 0) {
            return PriceBucket.HIGH;
        }
        return PriceBucket.MID;
    }
}
