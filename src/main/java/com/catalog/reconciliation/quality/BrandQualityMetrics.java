package com.catalog.reconciliation.quality;

/**
 * Coverage of one brand's products in a view. Percentages are 0 to 100, rounded to
 * one decimal.
 *
 * @param brandSlug            the brand
 * @param skuCount             products counted (LOW confidence brands excluded)
 * @param formCoverage         share with a form
 * @param lifeStageCoverage    share with a life stage
 * @param ingredientsCoverage  share with ingredient tokens
 * @param kcalCoverage         share with energy inside the plausible range
 * @param priceCoverage        share with a price per kg
 * @param priceBucketCoverage  share with a price bucket
 * @param kcalOutliers         products whose energy is present but implausible
 * @param completionPercent    mean of form, life stage, ingredients, kcal and price coverage
 */
public record BrandQualityMetrics(String brandSlug,
                                  int skuCount,
                                  double formCoverage,
                                  double lifeStageCoverage,
                                  double ingredientsCoverage,
                                  double kcalCoverage,
                                  double priceCoverage,
                                  double priceBucketCoverage,
                                  int kcalOutliers,
                                  double completionPercent) {
}
