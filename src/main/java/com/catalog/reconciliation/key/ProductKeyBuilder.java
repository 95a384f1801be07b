package com.catalog.reconciliation.key;

import com.catalog.reconciliation.core.model.CanonicalKey;
import com.catalog.reconciliation.rules.DefaultNameRules;
import com.catalog.reconciliation.rules.NormalizationEngine;
import com.catalog.reconciliation.rules.PackSizeStripping;

import java.util.Collection;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Derives the deterministic product key {@code brand_slug::name_slug::form}.
 *
 * <p>The name slug is the cleaned product name run through the name rules
 * (pack sizes and stop-list words removed), lower-cased, with whitespace turned
 * into single hyphens. The builder holds no mutable state and may be shared.</p>
 */
public class ProductKeyBuilder {

    static final String EMPTY_NAME_SLUG = "unnamed";

    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern HYPHEN_RUNS = Pattern.compile("-{2,}");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");

    private final NormalizationEngine nameEngine;
    private final PackSizeStripping packSizeStripping;

    public ProductKeyBuilder() {
        this(DefaultNameRules.createDefaultEngine(), PackSizeStripping.MULTIPACK_ONLY);
    }

    public ProductKeyBuilder(Collection<String> stopList, PackSizeStripping packSizeStripping) {
        this(DefaultNameRules.createEngine(stopList), packSizeStripping);
    }

    public ProductKeyBuilder(NormalizationEngine nameEngine, PackSizeStripping packSizeStripping) {
        this.nameEngine = Objects.requireNonNull(nameEngine, "nameEngine is required");
        this.packSizeStripping = Objects.requireNonNull(packSizeStripping, "packSizeStripping is required");
    }

    public CanonicalKey buildKey(String brandSlug, String cleanedProductName, String form) {
        Objects.requireNonNull(brandSlug, "brandSlug is required");
        return new CanonicalKey(brandSlug, nameSlug(cleanedProductName), form);
    }

    /**
     * {@code "Adult 15kg"} gives {@code adult-15kg}; {@code "Adult 12 x 85g"} gives {@code adult}.
     */
    public String nameSlug(String cleanedProductName) {
        String normalized = nameEngine.normalize(cleanedProductName, packSizeStripping);
        String slug = SPACES.matcher(normalized).replaceAll("-");
        slug = HYPHEN_RUNS.matcher(slug).replaceAll("-");
        slug = EDGE_HYPHENS.matcher(slug).replaceAll("");
        return slug.isEmpty() ? EMPTY_NAME_SLUG : slug;
    }

    public PackSizeStripping getPackSizeStripping() {
        return packSizeStripping;
    }
}
