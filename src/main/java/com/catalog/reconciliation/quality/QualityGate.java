package com.catalog.reconciliation.quality;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimum coverage a brand needs before it can be promoted from PENDING to ACTIVE.
 */
public record QualityGate(double minFormCoverage,
                          double minLifeStageCoverage,
                          double minIngredientsCoverage,
                          double minPriceBucketCoverage,
                          int maxKcalOutliers) {

    public QualityGate {
        if (maxKcalOutliers < 0) {
            throw new IllegalArgumentException("maxKcalOutliers must be >= 0");
        }
    }

    /**
     * Form 95%, life stage 95%, ingredients 85%, price bucket 70%, no kcal outliers.
     */
    public static QualityGate defaults() {
        return new QualityGate(95.0, 95.0, 85.0, 70.0, 0);
    }

    public boolean passes(BrandQualityMetrics metrics) {
        return failures(metrics).isEmpty();
    }

    /**
     * Human-readable list of the thresholds the brand misses.
     */
    public List<String> failures(BrandQualityMetrics metrics) {
        List<String> failures = new ArrayList<>();
        if (metrics.formCoverage() < minFormCoverage) {
            failures.add("form coverage " + metrics.formCoverage() + " < " + minFormCoverage);
        }
        if (metrics.lifeStageCoverage() < minLifeStageCoverage) {
            failures.add("life stage coverage " + metrics.lifeStageCoverage() + " < " + minLifeStageCoverage);
        }
        if (metrics.ingredientsCoverage() < minIngredientsCoverage) {
            failures.add("ingredients coverage " + metrics.ingredientsCoverage() + " < " + minIngredientsCoverage);
        }
        if (metrics.priceBucketCoverage() < minPriceBucketCoverage) {
            failures.add("price bucket coverage " + metrics.priceBucketCoverage() + " < " + minPriceBucketCoverage);
        }
        if (metrics.kcalOutliers() > maxKcalOutliers) {
            failures.add("kcal outliers " + metrics.kcalOutliers() + " > " + maxKcalOutliers);
        }
        return failures;
    }
}
