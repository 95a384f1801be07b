package com.catalog.reconciliation.guard;

import com.catalog.reconciliation.core.model.CanonicalProduct;

import java.util.Optional;

/**
 * No brand slug folds a product line into the brand ({@code purina_pro_plan}); lines
 * belong in {@code brand_line}.
 */
public class NonCanonicalSlugGuard extends AbstractGuardRule {

    public static final String NAME = "non-canonical-slug";

    private final BrandKnowledge knowledge;

    public NonCanonicalSlugGuard(BrandKnowledge knowledge) {
        this.knowledge = knowledge;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected Optional<String> inspect(CanonicalProduct product) {
        if (knowledge.getCompositeSlugs().contains(product.getBrandSlug())) {
            return Optional.of("brand_slug '" + product.getBrandSlug() + "' is a brand+line composite");
        }
        return Optional.empty();
    }
}
