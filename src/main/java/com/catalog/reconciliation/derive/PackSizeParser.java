package com.catalog.reconciliation.derive;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses pack-size text ({@code 2kg}, {@code 400 g}, {@code 12 x 85g}, {@code 4.4lb}) into grams.
 */
public class PackSizeParser {

    private static final String UNIT = "(kg|g|gr|lb|lbs|oz)";
    private static final Pattern MULTIPACK = Pattern.compile(
            "(\\d+)\\s*[x\\u00D7]\\s*(\\d+(?:[.,]\\d+)?)\\s*" + UNIT + "(?![\\p{L}])");
    private static final Pattern SINGLE = Pattern.compile(
            "(\\d+(?:[.,]\\d+)?)\\s*" + UNIT + "(?![\\p{L}])");

    private static final BigDecimal GRAMS_PER_KG = new BigDecimal("1000");
    private static final BigDecimal GRAMS_PER_LB = new BigDecimal("453.592");
    private static final BigDecimal GRAMS_PER_OZ = new BigDecimal("28.3495");

    public Optional<PackSize> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);

        Matcher multi = MULTIPACK.matcher(lower);
        if (multi.find()) {
            BigDecimal count = new BigDecimal(multi.group(1));
            BigDecimal amount = toGrams(number(multi.group(2)), multi.group(3));
            return positive(amount.multiply(count), true, text);
        }

        Matcher single = SINGLE.matcher(lower);
        if (single.find()) {
            return positive(toGrams(number(single.group(1)), single.group(2)), false, text);
        }
        return Optional.empty();
    }

    /**
     * First parsable size from the list, then from {@code fallbackText} (usually the product name).
     */
    public Optional<PackSize> firstParsable(List<String> packSizes, String fallbackText) {
        if (packSizes != null) {
            for (String size : packSizes) {
                Optional<PackSize> parsed = parse(size);
                if (parsed.isPresent()) {
                    return parsed;
                }
            }
        }
        return parse(fallbackText);
    }

    private static Optional<PackSize> positive(BigDecimal grams, boolean multipack, String display) {
        if (grams.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(new PackSize(grams, multipack, display));
    }

    private static BigDecimal number(String text) {
        return new BigDecimal(text.replace(',', '.'));
    }

    private static BigDecimal toGrams(BigDecimal amount, String unit) {
        return switch (unit) {
            case "kg" -> amount.multiply(GRAMS_PER_KG);
            case "lb", "lbs" -> amount.multiply(GRAMS_PER_LB);
            case "oz" -> amount.multiply(GRAMS_PER_OZ);
            default -> amount;
        };
    }
}
