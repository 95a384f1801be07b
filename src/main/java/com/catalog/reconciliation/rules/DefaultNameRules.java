package com.catalog.reconciliation.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Built-in product-name rules used to derive the name slug of a product key.
 */
public final class DefaultNameRules {

    /**
     * Marketing boilerplate that never distinguishes two products.
     */
    public static final List<String> DEFAULT_STOP_LIST = List.of(
            "complete", "premium", "super premium", "holistic", "formula", "recipe",
            "dog food", "dogfood", "flavour", "flavor", "new", "improved");

    private static final String UNIT = "(?:kg|g|gr|lb|lbs|oz|ml|l)";
    private static final String NUMBER = "\\d+(?:[.,]\\d+)?";

    private DefaultNameRules() {
        // Utility class
    }

    public static NormalizationEngine createEngine(Collection<String> stopList) {
        List<NormalizationRule> rules = new ArrayList<>(packSizeRules());
        rules.addAll(cleanupRules());
        NormalizationRule stopRule = stopListRule(stopList);
        if (stopRule != null) {
            rules.add(stopRule);
        }
        return new NormalizationEngine(rules);
    }

    public static NormalizationEngine createDefaultEngine() {
        return createEngine(DEFAULT_STOP_LIST);
    }

    public static List<NormalizationRule> packSizeRules() {
        return List.of(
                // "12x85g", "12 x 85 g", "2 × 12kg"
                NormalizationRule.of("pack-multipack",
                        "\\b\\d+\\s*[x\\u00D7]\\s*" + NUMBER + "\\s*" + UNIT + "\\b",
                        " ", 10),

                // "(400g)", "[2kg]"
                NormalizationRule.of("pack-bracketed",
                        "[(\\[]\\s*(" + NUMBER + ")\\s*(" + UNIT + ")\\s*[)\\]]",
                        " $1$2 ", 11),

                // "6 pack", "24pk"
                NormalizationRule.of("pack-count",
                        "\\b\\d+\\s*(?:pack|pk|pcs)\\b",
                        " ", 12),

                // "1,5kg" -> "1.5kg"
                NormalizationRule.of("pack-decimal-comma",
                        "\\b(\\d+),(\\d+)\\s*(" + UNIT + ")\\b",
                        "$1.$2$3", 14),

                // "15 kg" -> "15kg"
                NormalizationRule.of("pack-unit-join",
                        "\\b(" + NUMBER + ")\\s+(" + UNIT + ")\\b",
                        "$1$2", 15)
                        .onlyFor(PackSizeStripping.MULTIPACK_ONLY),

                NormalizationRule.of("pack-single",
                        "\\b" + NUMBER + "\\s*" + UNIT + "\\b",
                        " ", 15)
                        .onlyFor(PackSizeStripping.ALL)
        );
    }

    public static List<NormalizationRule> cleanupRules() {
        return List.of(
                NormalizationRule.of("name-apostrophes",
                        "['\\u2019]",
                        "", 5),

                // keep letters, digits and decimal points
                NormalizationRule.of("name-special-chars",
                        "[^\\p{L}\\p{N}\\s.]",
                        " ", 50),

                NormalizationRule.of("name-stray-dots",
                        "(?<!\\d)\\.|\\.(?!\\d)",
                        " ", 51),

                NormalizationRule.of("name-collapse-spaces",
                        "\\s+",
                        " ", 200)
        );
    }

    static NormalizationRule stopListRule(Collection<String> stopList) {
        if (stopList == null || stopList.isEmpty()) {
            return null;
        }
        String alternation = stopList.stream()
                .filter(word -> word != null && !word.isBlank())
                .sorted((a, b) -> b.length() != a.length() ? b.length() - a.length() : a.compareTo(b))
                .map(word -> BrandText.phraseRegex(word.trim()))
                .collect(Collectors.joining("|"));
        if (alternation.isEmpty()) {
            return null;
        }
        return NormalizationRule.of("name-stop-list",
                "(?<![\\p{L}\\p{N}])(?:" + alternation + ")" + BrandText.WORD_END,
                " ", 60);
    }
}
