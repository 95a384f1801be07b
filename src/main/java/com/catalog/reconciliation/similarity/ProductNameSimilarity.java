package com.catalog.reconciliation.similarity;

import com.catalog.reconciliation.rules.DefaultNameRules;
import com.catalog.reconciliation.rules.NormalizationEngine;
import com.catalog.reconciliation.rules.PackSizeStripping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Similarity of two cleaned product names sharing a product key.
 *
 * <p>Names are compared without pack sizes and punctuation, so packaging variants of
 * one product score 1.0, while names that only collapsed to the same key through
 * stop-list removal score lower.</p>
 */
public class ProductNameSimilarity implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(ProductNameSimilarity.class);

    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final TokenJaccardSimilarity tokenJaccard = new TokenJaccardSimilarity();
    private final NormalizationEngine comparableForm;
    private final NameSimilarityWeights weights;

    public ProductNameSimilarity() {
        this(NameSimilarityWeights.defaults());
    }

    public ProductNameSimilarity(NameSimilarityWeights weights) {
        this.weights = weights;
        this.comparableForm = DefaultNameRules.createEngine(List.of());
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        String a = comparable(s1);
        String b = comparable(s2);
        if (a.equals(b)) {
            return 1.0;
        }
        double jw = jaroWinkler.compute(a, b);
        double jaccard = tokenJaccard.compute(a, b);
        double score = weights.jaroWinkler() * jw + weights.tokenJaccard() * jaccard;
        log.trace("similarity '{}' vs '{}': jaroWinkler={} tokenJaccard={} score={}", a, b, jw, jaccard, score);
        return score;
    }

    @Override
    public String getName() {
        return "product-name";
    }

    /**
     * Lower-case name without pack sizes or punctuation.
     */
    public String comparable(String name) {
        return comparableForm.normalize(name, PackSizeStripping.ALL);
    }
}
