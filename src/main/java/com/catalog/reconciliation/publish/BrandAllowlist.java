package com.catalog.reconciliation.publish;

import com.catalog.reconciliation.core.model.AllowlistStatus;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Versioned table of brand promotion states. Immutable: every change yields a new
 * version, and a run reads the version it was started with.
 */
public final class BrandAllowlist {

    private final long version;
    private final Map<String, AllowlistStatus> statuses;

    private BrandAllowlist(long version, Map<String, AllowlistStatus> statuses) {
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
        this.version = version;
        this.statuses = Collections.unmodifiableMap(new TreeMap<>(statuses));
    }

    public static BrandAllowlist empty() {
        return new BrandAllowlist(0, Map.of());
    }

    public static BrandAllowlist of(long version, Map<String, AllowlistStatus> statuses) {
        return new BrandAllowlist(version, statuses);
    }

    public long getVersion() {
        return version;
    }

    public Optional<AllowlistStatus> statusOf(String brandSlug) {
        return Optional.ofNullable(statuses.get(brandSlug));
    }

    public boolean isActive(String brandSlug) {
        return statusOf(brandSlug).map(AllowlistStatus::isProductionEligible).orElse(false);
    }

    public Map<String, AllowlistStatus> getStatuses() {
        return statuses;
    }

    /**
     * Next version with {@code brandSlug} set to {@code status}.
     */
    public BrandAllowlist withStatus(String brandSlug, AllowlistStatus status) {
        Objects.requireNonNull(brandSlug, "brandSlug is required");
        Objects.requireNonNull(status, "status is required");
        Map<String, AllowlistStatus> next = new TreeMap<>(statuses);
        next.put(brandSlug, status);
        return new BrandAllowlist(version + 1, next);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BrandAllowlist that = (BrandAllowlist) o;
        return version == that.version && statuses.equals(that.statuses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, statuses);
    }

    @Override
    public String toString() {
        return "BrandAllowlist{version=" + version + ", brands=" + statuses.size() + '}';
    }
}
