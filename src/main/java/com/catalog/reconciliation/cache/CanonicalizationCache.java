package com.catalog.reconciliation.cache;

import com.catalog.reconciliation.rules.BrandResolution;

import java.util.function.Supplier;

/**
 * Memoizes brand canonicalization per {@code (alias map version, brand_raw, product_name_raw)}.
 * Entries of one alias-map version are never served for another.
 */
public interface CanonicalizationCache {

    /**
     * Returns the cached resolution or computes, stores and returns it.
     */
    BrandResolution get(String aliasVersion, String brandRaw, String productNameRaw,
                        Supplier<BrandResolution> loader);

    /**
     * Drops every entry computed against {@code aliasVersion}.
     */
    void invalidateVersion(String aliasVersion);

    void invalidateAll();

    CacheStats getStats();

    static CanonicalizationCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineCanonicalizationCache(config) : new NoOpCanonicalizationCache();
    }
}
