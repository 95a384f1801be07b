package com.catalog.reconciliation.rules;

import com.catalog.reconciliation.core.model.BrandConfidence;

import java.util.Objects;

/**
 * Outcome of brand canonicalization for one record.
 *
 * @param brandSlug    canonical slug, or the slugged raw brand when unresolved
 * @param brandLine    product line within the brand, if the matched alias names one
 * @param brandDisplay display name of the brand
 * @param cleanedName  product name with brand fragments removed
 * @param confidence   LOW when no alias matched
 * @param matchedAlias alias phrase that produced the match, null when unresolved
 */
public record BrandResolution(String brandSlug, String brandLine, String brandDisplay,
                              String cleanedName, BrandConfidence confidence, String matchedAlias) {

    public BrandResolution {
        Objects.requireNonNull(brandSlug, "brandSlug is required");
        Objects.requireNonNull(cleanedName, "cleanedName is required");
        Objects.requireNonNull(confidence, "confidence is required");
    }

    public boolean isResolved() {
        return confidence == BrandConfidence.HIGH;
    }
}
