package com.catalog.reconciliation.similarity;

/**
 * A string similarity measure in {@code [0, 1]}, where 1 means identical.
 */
public interface SimilarityAlgorithm {

    double compute(String s1, String s2);

    String getName();
}
