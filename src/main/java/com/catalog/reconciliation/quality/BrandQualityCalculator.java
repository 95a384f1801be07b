package com.catalog.reconciliation.quality;

import com.catalog.reconciliation.core.model.BrandConfidence;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.CatalogField;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Computes {@link BrandQualityMetrics} over a product set. Products whose brand did not
 * resolve ({@code confidence=low}) are left out until the alias is fixed.
 */
public class BrandQualityCalculator {

    public static final double MIN_PLAUSIBLE_KCAL = 200.0;
    public static final double MAX_PLAUSIBLE_KCAL = 600.0;

    public Map<String, BrandQualityMetrics> calculateAll(Collection<CanonicalProduct> products) {
        Map<String, List<CanonicalProduct>> byBrand = new TreeMap<>();
        for (CanonicalProduct product : products) {
            if (product.getBrandConfidence() == BrandConfidence.LOW) {
                continue;
            }
            byBrand.computeIfAbsent(product.getBrandSlug(), k -> new ArrayList<>()).add(product);
        }
        Map<String, BrandQualityMetrics> result = new TreeMap<>();
        byBrand.forEach((slug, list) -> result.put(slug, calculate(slug, list)));
        return result;
    }

    public Optional<BrandQualityMetrics> calculate(String brandSlug, Collection<CanonicalProduct> products) {
        List<CanonicalProduct> brandProducts = new ArrayList<>();
        for (CanonicalProduct product : products) {
            if (brandSlug.equals(product.getBrandSlug()) && product.getBrandConfidence() != BrandConfidence.LOW) {
                brandProducts.add(product);
            }
        }
        return brandProducts.isEmpty() ? Optional.empty() : Optional.of(calculate(brandSlug, brandProducts));
    }

    private BrandQualityMetrics calculate(String brandSlug, List<CanonicalProduct> products) {
        int form = 0;
        int lifeStage = 0;
        int ingredients = 0;
        int kcalInRange = 0;
        int kcalOutliers = 0;
        int price = 0;
        int bucket = 0;
        for (CanonicalProduct product : products) {
            if (product.has(CatalogField.FORM)) form++;
            if (product.has(CatalogField.LIFE_STAGE)) lifeStage++;
            if (!product.getIngredientsTokens().isEmpty()) ingredients++;
            if (product.has(CatalogField.PRICE_PER_KG)) price++;
            if (product.has(CatalogField.PRICE_BUCKET)) bucket++;
            Double kcal = product.getKcalPer100g();
            if (kcal != null) {
                if (kcal >= MIN_PLAUSIBLE_KCAL && kcal <= MAX_PLAUSIBLE_KCAL) {
                    kcalInRange++;
                } else {
                    kcalOutliers++;
                }
            }
        }
        int n = products.size();
        double formPct = percent(form, n);
        double lifeStagePct = percent(lifeStage, n);
        double ingredientsPct = percent(ingredients, n);
        double kcalPct = percent(kcalInRange, n);
        double pricePct = percent(price, n);
        double completion = round1((formPct + lifeStagePct + ingredientsPct + kcalPct + pricePct) / 5.0);
        return new BrandQualityMetrics(brandSlug, n, formPct, lifeStagePct, ingredientsPct, kcalPct, pricePct,
                percent(bucket, n), kcalOutliers, completion);
    }

    private static double percent(int count, int total) {
        return total == 0 ? 0.0 : round1(count * 100.0 / total);
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
