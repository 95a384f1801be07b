package com.catalog.reconciliation.cache;

import com.catalog.reconciliation.rules.BrandResolution;

import java.util.function.Supplier;

/**
 * Pass-through cache; the default when caching is disabled.
 */
public class NoOpCanonicalizationCache implements CanonicalizationCache {

    @Override
    public BrandResolution get(String aliasVersion, String brandRaw, String productNameRaw,
                               Supplier<BrandResolution> loader) {
        return loader.get();
    }

    @Override
    public void invalidateVersion(String aliasVersion) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
