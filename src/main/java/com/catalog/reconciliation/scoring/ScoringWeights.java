package com.catalog.reconciliation.scoring;

/**
 * Additive field-presence weights. All weights are non-negative, which keeps the
 * score monotonic: adding a field never lowers it.
 */
public record ScoringWeights(int energy, int protein, int fat, int ingredients, int image) {

    public ScoringWeights {
        if (energy < 0 || protein < 0 || fat < 0 || ingredients < 0 || image < 0) {
            throw new IllegalArgumentException("scoring weights must be non-negative");
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(100, 10, 10, 5, 2);
    }
}
