package com.catalog.reconciliation.publish;

import com.catalog.reconciliation.core.model.CanonicalProduct;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One published product set with the inputs it was computed from.
 */
public final class CatalogSnapshot {

    private static final CatalogSnapshot EMPTY = new CatalogSnapshot(null, null, null, -1, -1, List.of(), null);

    private final String runId;
    private final Instant watermark;
    private final String aliasMapVersion;
    private final long allowlistVersion;
    private final long overrideVersion;
    private final List<CanonicalProduct> products;
    private final Map<String, CanonicalProduct> byKey;
    private final Instant publishedAt;

    public CatalogSnapshot(String runId, Instant watermark, String aliasMapVersion, long allowlistVersion,
                           long overrideVersion, List<CanonicalProduct> products, Instant publishedAt) {
        this.runId = runId;
        this.watermark = watermark;
        this.aliasMapVersion = aliasMapVersion;
        this.allowlistVersion = allowlistVersion;
        this.overrideVersion = overrideVersion;
        this.products = List.copyOf(products);
        Map<String, CanonicalProduct> index = new LinkedHashMap<>();
        for (CanonicalProduct product : this.products) {
            index.putIfAbsent(product.getProductKey(), product);
        }
        this.byKey = Map.copyOf(index);
        this.publishedAt = publishedAt;
    }

    public static CatalogSnapshot empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return products.isEmpty();
    }

    public String getRunId() {
        return runId;
    }

    public Instant getWatermark() {
        return watermark;
    }

    public String getAliasMapVersion() {
        return aliasMapVersion;
    }

    public long getAllowlistVersion() {
        return allowlistVersion;
    }

    public long getOverrideVersion() {
        return overrideVersion;
    }

    public List<CanonicalProduct> getProducts() {
        return products;
    }

    public Optional<CanonicalProduct> find(String productKey) {
        return Optional.ofNullable(byKey.get(productKey));
    }

    public int size() {
        return products.size();
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    /**
     * Same metadata, different product set.
     */
    CatalogSnapshot withProducts(List<CanonicalProduct> subset) {
        return new CatalogSnapshot(runId, watermark, aliasMapVersion, allowlistVersion, overrideVersion,
                subset, publishedAt);
    }
}
