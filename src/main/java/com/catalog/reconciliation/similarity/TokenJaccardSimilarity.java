package com.catalog.reconciliation.similarity;

import java.util.Set;
import java.util.TreeSet;

/**
 * Word-set overlap: {@code |A ∩ B| / |A ∪ B|} over whitespace-separated tokens.
 */
public class TokenJaccardSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> a = tokens(s1);
        Set<String> b = tokens(s2);
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        long shared = a.stream().filter(b::contains).count();
        return (double) shared / (a.size() + b.size() - shared);
    }

    @Override
    public String getName() {
        return "token-jaccard";
    }

    private static Set<String> tokens(String text) {
        Set<String> tokens = new TreeSet<>();
        for (String token : text.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
