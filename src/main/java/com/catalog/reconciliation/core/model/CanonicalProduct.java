package com.catalog.reconciliation.core.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * One real-world product as published: the merge of every candidate record
 * sharing a {@link CanonicalKey}, with overrides layered on top.
 *
 * <p>Instances are immutable and compare by value, so two merges of the same
 * input produce equal products regardless of record order.</p>
 */
public final class CanonicalProduct {

    private final String productKey;
    private final CanonicalKey canonicalKey;
    private final String brandSlug;
    private final BrandConfidence brandConfidence;
    private final Map<CatalogField, Object> values;
    private final Map<CatalogField, FieldProvenance> provenance;
    private final List<SourceContribution> sources;
    private final CompletenessGrade completenessGrade;
    private final AllowlistStatus allowlistStatus;
    private final List<String> appliedOverrideIds;

    private CanonicalProduct(Builder builder) {
        this.canonicalKey = Objects.requireNonNull(builder.canonicalKey, "canonicalKey is required");
        this.productKey = builder.productKey != null ? builder.productKey : canonicalKey.productKey();
        this.brandSlug = builder.brandSlug != null ? builder.brandSlug : canonicalKey.brandSlug();
        this.brandConfidence = builder.brandConfidence != null ? builder.brandConfidence : BrandConfidence.HIGH;
        this.values = Collections.unmodifiableMap(new EnumMap<>(builder.values));
        this.provenance = Collections.unmodifiableMap(new EnumMap<>(builder.provenance));
        this.sources = List.copyOf(builder.sources);
        this.completenessGrade = builder.completenessGrade != null ? builder.completenessGrade : CompletenessGrade.C;
        this.allowlistStatus = builder.allowlistStatus;
        this.appliedOverrideIds = List.copyOf(builder.appliedOverrideIds);
    }

    /**
     * Published key; equal to the canonical key unless a collision forced a {@code ~n} suffix.
     */
    public String getProductKey() {
        return productKey;
    }

    public CanonicalKey getCanonicalKey() {
        return canonicalKey;
    }

    public String getBrandSlug() {
        return brandSlug;
    }

    public BrandConfidence getBrandConfidence() {
        return brandConfidence;
    }

    public Object get(CatalogField field) {
        return values.get(field);
    }

    public boolean has(CatalogField field) {
        return values.containsKey(field);
    }

    public Map<CatalogField, Object> getValues() {
        return values;
    }

    public FieldProvenance getProvenance(CatalogField field) {
        return provenance.get(field);
    }

    public Map<CatalogField, FieldProvenance> getProvenance() {
        return provenance;
    }

    public List<SourceContribution> getSources() {
        return sources;
    }

    public CompletenessGrade getCompletenessGrade() {
        return completenessGrade;
    }

    /**
     * Status inherited from the owning brand; null until the product is published.
     */
    public AllowlistStatus getAllowlistStatus() {
        return allowlistStatus;
    }

    public List<String> getAppliedOverrideIds() {
        return appliedOverrideIds;
    }

    public String getBrand() {
        return (String) values.get(CatalogField.BRAND);
    }

    public String getBrandLine() {
        return (String) values.get(CatalogField.BRAND_LINE);
    }

    public String getProductName() {
        return (String) values.get(CatalogField.PRODUCT_NAME);
    }

    public String getForm() {
        return (String) values.get(CatalogField.FORM);
    }

    public String getLifeStage() {
        return (String) values.get(CatalogField.LIFE_STAGE);
    }

    public Double getKcalPer100g() {
        return (Double) values.get(CatalogField.KCAL_PER_100G);
    }

    public Double getProteinPercent() {
        return (Double) values.get(CatalogField.PROTEIN_PERCENT);
    }

    public Double getFatPercent() {
        return (Double) values.get(CatalogField.FAT_PERCENT);
    }

    public Double getFiberPercent() {
        return (Double) values.get(CatalogField.FIBER_PERCENT);
    }

    public Double getAshPercent() {
        return (Double) values.get(CatalogField.ASH_PERCENT);
    }

    public Double getMoisturePercent() {
        return (Double) values.get(CatalogField.MOISTURE_PERCENT);
    }

    public String getIngredientsRaw() {
        return (String) values.get(CatalogField.INGREDIENTS_RAW);
    }

    @SuppressWarnings("unchecked")
    public List<String> getIngredientsTokens() {
        Object tokens = values.get(CatalogField.INGREDIENTS_TOKENS);
        return tokens == null ? List.of() : (List<String>) tokens;
    }

    @SuppressWarnings("unchecked")
    public List<String> getPackSizes() {
        Object sizes = values.get(CatalogField.PACK_SIZES);
        return sizes == null ? List.of() : (List<String>) sizes;
    }

    public BigDecimal getPricePerKg() {
        return (BigDecimal) values.get(CatalogField.PRICE_PER_KG);
    }

    public PriceBucket getPriceBucket() {
        return (PriceBucket) values.get(CatalogField.PRICE_BUCKET);
    }

    public String getImageUrl() {
        return (String) values.get(CatalogField.IMAGE_URL);
    }

    @SuppressWarnings("unchecked")
    public Set<String> getAvailableCountries() {
        Object countries = values.get(CatalogField.AVAILABLE_COUNTRIES);
        return countries == null ? Set.of() : (Set<String>) countries;
    }

    public CanonicalProduct withAllowlistStatus(AllowlistStatus status) {
        return toBuilder().allowlistStatus(status).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .productKey(productKey)
                .canonicalKey(canonicalKey)
                .brandSlug(brandSlug)
                .brandConfidence(brandConfidence)
                .sources(sources)
                .completenessGrade(completenessGrade)
                .allowlistStatus(allowlistStatus)
                .appliedOverrideIds(appliedOverrideIds);
        builder.values.putAll(values);
        builder.provenance.putAll(provenance);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalProduct that = (CanonicalProduct) o;
        return productKey.equals(that.productKey)
                && canonicalKey.equals(that.canonicalKey)
                && brandSlug.equals(that.brandSlug)
                && brandConfidence == that.brandConfidence
                && values.equals(that.values)
                && provenance.equals(that.provenance)
                && sources.equals(that.sources)
                && completenessGrade == that.completenessGrade
                && allowlistStatus == that.allowlistStatus
                && appliedOverrideIds.equals(that.appliedOverrideIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productKey, canonicalKey, brandSlug, brandConfidence, values, provenance,
                sources, completenessGrade, allowlistStatus, appliedOverrideIds);
    }

    @Override
    public String toString() {
        return "CanonicalProduct{" +
                "productKey='" + productKey + '\'' +
                ", brand='" + getBrand() + '\'' +
                ", productName='" + getProductName() + '\'' +
                ", grade=" + completenessGrade.label() +
                ", sources=" + sources.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String productKey;
        private CanonicalKey canonicalKey;
        private String brandSlug;
        private BrandConfidence brandConfidence;
        private final Map<CatalogField, Object> values = new EnumMap<>(CatalogField.class);
        private final Map<CatalogField, FieldProvenance> provenance = new EnumMap<>(CatalogField.class);
        private List<SourceContribution> sources = new ArrayList<>();
        private CompletenessGrade completenessGrade;
        private AllowlistStatus allowlistStatus;
        private List<String> appliedOverrideIds = new ArrayList<>();

        public Builder productKey(String productKey) {
            this.productKey = productKey;
            return this;
        }

        public Builder canonicalKey(CanonicalKey canonicalKey) {
            this.canonicalKey = canonicalKey;
            return this;
        }

        public Builder brandSlug(String brandSlug) {
            this.brandSlug = brandSlug;
            return this;
        }

        public Builder brandConfidence(BrandConfidence brandConfidence) {
            this.brandConfidence = brandConfidence;
            return this;
        }

        /**
         * Sets a field value with its provenance. A null value clears the field.
         *
         * @throws IllegalArgumentException if the value has the wrong type for the field
         */
        public Builder value(CatalogField field, Object value, FieldProvenance origin) {
            Objects.requireNonNull(field, "field is required");
            if (value == null) {
                values.remove(field);
                provenance.remove(field);
                return this;
            }
            if (!field.accepts(value)) {
                throw new IllegalArgumentException("Value of type " + value.getClass().getSimpleName()
                        + " not accepted for field " + field.wireName());
            }
            values.put(field, normalize(field, value));
            provenance.put(field, Objects.requireNonNull(origin, "provenance is required"));
            return this;
        }

        public Builder clear(CatalogField field) {
            return value(field, null, null);
        }

        public Object peek(CatalogField field) {
            return values.get(field);
        }

        public FieldProvenance peekProvenance(CatalogField field) {
            return provenance.get(field);
        }

        public Builder sources(List<SourceContribution> sources) {
            this.sources = new ArrayList<>(sources);
            return this;
        }

        public Builder completenessGrade(CompletenessGrade completenessGrade) {
            this.completenessGrade = completenessGrade;
            return this;
        }

        public Builder allowlistStatus(AllowlistStatus allowlistStatus) {
            this.allowlistStatus = allowlistStatus;
            return this;
        }

        public Builder appliedOverrideIds(List<String> appliedOverrideIds) {
            this.appliedOverrideIds = new ArrayList<>(appliedOverrideIds);
            return this;
        }

        public Builder addAppliedOverrideId(String overrideId) {
            this.appliedOverrideIds.add(overrideId);
            return this;
        }

        public CanonicalProduct build() {
            return new CanonicalProduct(this);
        }

        private static Object normalize(CatalogField field, Object value) {
            if (field == CatalogField.AVAILABLE_COUNTRIES) {
                return Collections.unmodifiableSortedSet(new TreeSet<>(stringsOf((Collection<?>) value)));
            }
            if (value instanceof Collection<?> collection) {
                return List.copyOf(stringsOf(collection));
            }
            return value;
        }

        private static List<String> stringsOf(Collection<?> collection) {
            List<String> result = new ArrayList<>(collection.size());
            for (Object item : collection) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
    }
}
