package com.catalog.reconciliation.similarity;

/**
 * Weights of the product-name similarity blend; must sum to 1.
 */
public record NameSimilarityWeights(double jaroWinkler, double tokenJaccard) {

    public NameSimilarityWeights {
        if (jaroWinkler < 0 || tokenJaccard < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = jaroWinkler + tokenJaccard;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    public static NameSimilarityWeights defaults() {
        return new NameSimilarityWeights(0.5, 0.5);
    }
}
