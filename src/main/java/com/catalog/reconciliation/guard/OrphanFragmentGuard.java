package com.catalog.reconciliation.guard;

import com.catalog.reconciliation.core.model.CanonicalProduct;

import java.util.Optional;

/**
 * No product name starts with the tail of a multi-word brand ("Canin Adult") unless the
 * product belongs to that brand. Names starting with a denylisted phrase are exempt.
 */
public class OrphanFragmentGuard extends AbstractGuardRule {

    public static final String NAME = "orphan-fragment";

    private final BrandKnowledge knowledge;

    public OrphanFragmentGuard(BrandKnowledge knowledge) {
        this.knowledge = knowledge;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected Optional<String> inspect(CanonicalProduct product) {
        String name = product.getProductName();
        if (name == null || knowledge.getAliasMap().startsWithDenylisted(name)) {
            return Optional.empty();
        }
        for (BrandKnowledge.SplitPattern pattern : knowledge.getSplitPatterns()) {
            if (!pattern.brandSlug().equals(product.getBrandSlug())
                    && knowledge.nameStartsWithFragment(pattern, name)) {
                return Optional.of("product_name '" + name + "' starts with '" + pattern.fragment()
                        + "' of brand " + pattern.brandSlug() + " but brand_slug is " + product.getBrandSlug());
            }
        }
        return Optional.empty();
    }
}
