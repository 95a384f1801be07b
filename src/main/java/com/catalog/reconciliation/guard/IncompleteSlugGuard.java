package com.catalog.reconciliation.guard;

import com.catalog.reconciliation.core.model.CanonicalProduct;

import java.util.Optional;

/**
 * No brand slug is a partial stem ({@code royal}) that should have resolved to a longer
 * canonical slug.
 */
public class IncompleteSlugGuard extends AbstractGuardRule {

    public static final String NAME = "incomplete-slug";

    private final BrandKnowledge knowledge;

    public IncompleteSlugGuard(BrandKnowledge knowledge) {
        this.knowledge = knowledge;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected Optional<String> inspect(CanonicalProduct product) {
        if (knowledge.getIncompleteStems().contains(product.getBrandSlug())) {
            return Optional.of("brand_slug '" + product.getBrandSlug() + "' is an incomplete stem");
        }
        return Optional.empty();
    }
}
