package com.catalog.reconciliation.cache;

import com.catalog.reconciliation.rules.BrandResolution;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Caffeine-backed {@link CanonicalizationCache}, bounded by size and write age.
 */
public class CaffeineCanonicalizationCache implements CanonicalizationCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineCanonicalizationCache.class);

    private final Cache<Key, BrandResolution> cache;

    public CaffeineCanonicalizationCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxEntries())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("cache.initialized type=canonicalization maxEntries={} ttl={}", config.maxEntries(), config.ttl());
    }

    @Override
    public BrandResolution get(String aliasVersion, String brandRaw, String productNameRaw,
                               Supplier<BrandResolution> loader) {
        Objects.requireNonNull(aliasVersion, "aliasVersion is required");
        return cache.get(new Key(aliasVersion, brandRaw, productNameRaw), k -> loader.get());
    }

    @Override
    public void invalidateVersion(String aliasVersion) {
        int before = cache.asMap().size();
        cache.asMap().keySet().removeIf(key -> key.aliasVersion().equals(aliasVersion));
        log.debug("cache.invalidated aliasVersion={} removed={}", aliasVersion, before - cache.asMap().size());
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    private record Key(String aliasVersion, String brandRaw, String productNameRaw) {
    }
}
