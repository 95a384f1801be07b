package com.catalog.reconciliation.derive;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits a raw ingredient declaration into lower-case tokens.
 */
public class IngredientTokenizer {

    private static final Pattern SEPARATORS = Pattern.compile("[,;]");
    private static final Pattern PARENTHESISED = Pattern.compile("\\([^)]*\\)");
    private static final Pattern PERCENTAGES = Pattern.compile("\\d+(?:[.,]\\d+)?%?");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * "Chicken (25%), Rice; maize 4.5%" gives {@code [chicken, rice, maize]}.
     * Tokens of two characters or fewer are dropped.
     */
    public List<String> tokenize(String ingredientsRaw) {
        if (ingredientsRaw == null || ingredientsRaw.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String part : SEPARATORS.split(ingredientsRaw.toLowerCase(Locale.ROOT))) {
            String cleaned = PARENTHESISED.matcher(part).replaceAll("");
            cleaned = PERCENTAGES.matcher(cleaned).replaceAll("");
            cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
            if (cleaned.length() > 2) {
                tokens.add(cleaned);
            }
        }
        return List.copyOf(tokens);
    }
}
