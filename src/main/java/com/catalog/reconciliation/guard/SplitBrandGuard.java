package com.catalog.reconciliation.guard;

import com.catalog.reconciliation.core.model.CanonicalProduct;

import java.util.Optional;

/**
 * No product carries a brand cut in two: brand "Royal" with a name starting "Canin".
 */
public class SplitBrandGuard extends AbstractGuardRule {

    public static final String NAME = "split-brand";

    private final BrandKnowledge knowledge;

    public SplitBrandGuard(BrandKnowledge knowledge) {
        this.knowledge = knowledge;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected Optional<String> inspect(CanonicalProduct product) {
        for (BrandKnowledge.SplitPattern pattern : knowledge.getSplitPatterns()) {
            if (pattern.brandIsStem(product.getBrand())
                    && knowledge.nameStartsWithFragment(pattern, product.getProductName())) {
                return Optional.of("brand '" + product.getBrand() + "' with product_name '"
                        + product.getProductName() + "' splits " + pattern.brandSlug());
            }
        }
        return Optional.empty();
    }
}
