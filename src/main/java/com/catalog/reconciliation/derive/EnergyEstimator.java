package com.catalog.reconciliation.derive;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Energy density helpers: parsing declared energy text and estimating kcal/100g
 * from the analytical constituents.
 */
public class EnergyEstimator {

    private static final double KJ_PER_KCAL = 4.184;
    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:[.,]\\d+)?)");

    /**
     * Modified Atwater estimate:
     * {@code 4*protein + 9*fat + 4*max(0, 100 - protein - fat - fiber - ash - moisture)},
     * rounded to one decimal. Missing fiber, ash and moisture count as zero.
     *
     * @return empty unless protein and fat are both known
     */
    public Optional<Double> estimateKcalPer100g(Double protein, Double fat, Double fiber, Double ash, Double moisture) {
        if (protein == null || fat == null) {
            return Optional.empty();
        }
        double carbs = 100 - protein - fat - orZero(fiber) - orZero(ash) - orZero(moisture);
        double kcal = 4 * protein + 9 * fat + 4 * Math.max(0, carbs);
        return Optional.of(Math.round(kcal * 10) / 10.0);
    }

    /**
     * Parses declared energy such as {@code "365 kcal/100g"}, {@code "3650 kcal/kg"} or
     * {@code "1527 kJ/100g"} into kcal per 100 g, rounded to two decimals.
     */
    public Optional<Double> parseKcalPer100g(String declared) {
        if (declared == null || declared.isBlank()) {
            return Optional.empty();
        }
        String text = declared.toLowerCase(Locale.ROOT);
        Matcher matcher = NUMBER.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        double value = Double.parseDouble(matcher.group(1).replace(',', '.'));
        if (text.contains("kj")) {
            value = value / KJ_PER_KCAL;
        }
        if (text.contains("kg") && !text.contains("100")) {
            value = value / 10;
        }
        return Optional.of(Math.round(value * 100) / 100.0);
    }

    private static double orZero(Double value) {
        return value == null ? 0 : value;
    }
}
