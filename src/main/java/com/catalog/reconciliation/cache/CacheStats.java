package com.catalog.reconciliation.cache;

/**
 * Point-in-time cache counters.
 */
public record CacheStats(long hits, long misses, long evictions, long size) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
