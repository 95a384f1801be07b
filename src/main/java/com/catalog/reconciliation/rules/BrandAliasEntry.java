package com.catalog.reconciliation.rules;

import java.util.Objects;

/**
 * One row of the curated alias table.
 *
 * <p>A denylisted row names a phrase that must never be taken as a brand match
 * (for example {@code "Royal Canine"} must not resolve through {@code "Royal Canin"}).
 * Its slug and line are informational only.</p>
 *
 * @param aliasPhrase  phrase as written by curators, casing preserved
 * @param brandSlug    canonical brand slug the phrase resolves to
 * @param brandLine    optional product line slug within the brand
 * @param brandDisplay optional display name; defaults to the canonical display for the slug
 * @param denylisted   whether the phrase blocks matching instead of producing one
 */
public record BrandAliasEntry(String aliasPhrase, String brandSlug, String brandLine,
                              String brandDisplay, boolean denylisted) {

    public BrandAliasEntry {
        Objects.requireNonNull(aliasPhrase, "aliasPhrase is required");
        aliasPhrase = BrandText.normalizeWhitespace(BrandText.normalizeApostrophes(aliasPhrase));
        if (aliasPhrase.isEmpty()) {
            throw new IllegalArgumentException("aliasPhrase must not be blank");
        }
        if (!denylisted) {
            Objects.requireNonNull(brandSlug, "brandSlug is required for alias '" + aliasPhrase + "'");
        }
        brandLine = brandLine == null || brandLine.isBlank() ? null : brandLine.trim();
        brandDisplay = brandDisplay == null || brandDisplay.isBlank() ? null : brandDisplay.trim();
    }

    public static BrandAliasEntry alias(String aliasPhrase, String brandSlug) {
        return new BrandAliasEntry(aliasPhrase, brandSlug, null, null, false);
    }

    public static BrandAliasEntry alias(String aliasPhrase, String brandSlug, String brandLine) {
        return new BrandAliasEntry(aliasPhrase, brandSlug, brandLine, null, false);
    }

    public static BrandAliasEntry canonical(String displayName, String brandSlug) {
        return new BrandAliasEntry(displayName, brandSlug, null, displayName, false);
    }

    public static BrandAliasEntry deny(String phrase) {
        return new BrandAliasEntry(phrase, null, null, null, true);
    }

    /**
     * Number of whitespace-separated words in the phrase.
     */
    public int wordCount() {
        return aliasPhrase.split(" ").length;
    }
}
