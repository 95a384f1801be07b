package com.catalog.reconciliation.derive;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Price per kilogram from a pack price and its size.
 */
public class PriceCalculator {

    private static final BigDecimal GRAMS_PER_KG = new BigDecimal("1000");

    /**
     * {@code price / kg}, rounded half-up to two decimals. 4.50 for 400 g gives 11.25.
     */
    public Optional<BigDecimal> pricePerKg(BigDecimal price, PackSize packSize) {
        if (price == null || packSize == null || price.signum() < 0) {
            return Optional.empty();
        }
        BigDecimal kg = packSize.grams().divide(GRAMS_PER_KG);
        return Optional.of(price.divide(kg, 2, RoundingMode.HALF_UP));
    }
}
