package com.catalog.reconciliation.override;

import com.catalog.reconciliation.core.model.CatalogField;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Curator-supplied correction for a product or a whole brand.
 * An override is active from {@code createdAt} until {@code revokedAt}.
 */
public class CatalogOverride {

    private final String id;
    private final OverrideScope scope;
    private final String target;
    private final Map<CatalogField, OverrideValue> values;
    private final String reason;
    private final String createdBy;
    private final Instant createdAt;
    private final Instant revokedAt;

    private CatalogOverride(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.scope = Objects.requireNonNull(builder.scope, "scope is required");
        this.target = Objects.requireNonNull(builder.target, "target is required");
        this.values = Collections.unmodifiableMap(new EnumMap<>(builder.values));
        this.reason = builder.reason;
        this.createdBy = builder.createdBy;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.revokedAt = builder.revokedAt;
        if (values.isEmpty()) {
            throw new IllegalArgumentException("An override must carry at least one field");
        }
        if (scope == OverrideScope.BRAND_SLUG
                && (values.containsKey(CatalogField.PRODUCT_NAME) || values.containsKey(CatalogField.BRAND))) {
            throw new IllegalArgumentException("Brand-wide overrides cannot set brand or product_name");
        }
        if (revokedAt != null && revokedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("revokedAt must not precede createdAt");
        }
    }

    public String getId() {
        return id;
    }

    public OverrideScope getScope() {
        return scope;
    }

    public String getTarget() {
        return target;
    }

    public Map<CatalogField, OverrideValue> getValues() {
        return values;
    }

    public String getReason() {
        return reason;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getRevokedAt() {
        return revokedAt;
    }

    /**
     * True when the override exists and is not revoked as of {@code watermark}.
     */
    public boolean isActiveAt(Instant watermark) {
        return !createdAt.isAfter(watermark) && (revokedAt == null || revokedAt.isAfter(watermark));
    }

    public CatalogOverride revoke(Instant at) {
        return toBuilder().revokedAt(at).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .id(id)
                .scope(scope)
                .target(target)
                .reason(reason)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .revokedAt(revokedAt);
        builder.values.putAll(values);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CatalogOverride that = (CatalogOverride) o;
        return id.equals(that.id) && Objects.equals(revokedAt, that.revokedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, revokedAt);
    }

    @Override
    public String toString() {
        return "CatalogOverride{" +
                "id='" + id + '\'' +
                ", scope=" + scope +
                ", target='" + target + '\'' +
                ", fields=" + values.keySet() +
                ", revokedAt=" + revokedAt +
                '}';
    }

    public static Builder forProduct(String productKey) {
        return new Builder().scope(OverrideScope.PRODUCT_KEY).target(productKey);
    }

    public static Builder forBrand(String brandSlug) {
        return new Builder().scope(OverrideScope.BRAND_SLUG).target(brandSlug);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private OverrideScope scope;
        private String target;
        private final Map<CatalogField, OverrideValue> values = new EnumMap<>(CatalogField.class);
        private String reason;
        private String createdBy;
        private Instant createdAt;
        private Instant revokedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder scope(OverrideScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the value has the wrong type for the field
         */
        public Builder set(CatalogField field, Object value) {
            if (!field.accepts(value)) {
                throw new IllegalArgumentException("Value not accepted for field " + field.wireName());
            }
            values.put(field, OverrideValue.of(value));
            return this;
        }

        public Builder clear(CatalogField field) {
            values.put(field, OverrideValue.cleared());
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder revokedAt(Instant revokedAt) {
            this.revokedAt = revokedAt;
            return this;
        }

        public CatalogOverride build() {
            return new CatalogOverride(this);
        }
    }
}
