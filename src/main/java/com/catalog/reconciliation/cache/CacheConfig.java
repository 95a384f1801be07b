package com.catalog.reconciliation.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the canonicalization cache.
 *
 * @param maxEntries upper bound on cached resolutions
 * @param ttl        how long an entry lives after being written
 * @param enabled    whether a real cache is built at all
 */
public record CacheConfig(long maxEntries, Duration ttl, boolean enabled) {

    public CacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be > 0");
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    public static CacheConfig defaults() {
        return new CacheConfig(50_000, Duration.ofHours(1), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
