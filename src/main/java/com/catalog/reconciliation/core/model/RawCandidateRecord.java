package com.catalog.reconciliation.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * One observation of a product from one source at one point in time.
 * Owned by the harvesting side; the reconciliation engine only reads it.
 *
 * <p>The source id is the source domain joined with the product URL
 * ({@code domain|url}) unless an explicit id is supplied.</p>
 */
public class RawCandidateRecord {

    private final String sourceId;
    private final String sourceDomain;
    private final String sourceUrl;
    private final String brandRaw;
    private final String productNameRaw;
    private final String formRaw;
    private final String lifeStageRaw;
    private final String ingredientsRaw;
    private final Double kcalPer100g;
    private final Double proteinPercent;
    private final Double fatPercent;
    private final Double fiberPercent;
    private final Double ashPercent;
    private final Double moisturePercent;
    private final BigDecimal price;
    private final List<String> packSizes;
    private final Set<String> availableCountries;
    private final String imageUrl;
    private final Instant firstSeenAt;
    private final Instant lastSeenAt;

    private RawCandidateRecord(Builder builder) {
        this.sourceDomain = Objects.requireNonNull(builder.sourceDomain, "sourceDomain is required")
                .trim().toLowerCase(Locale.ROOT);
        this.sourceUrl = builder.sourceUrl;
        this.sourceId = builder.sourceId != null ? builder.sourceId
                : sourceDomain + (sourceUrl != null ? "|" + sourceUrl : "");
        this.brandRaw = builder.brandRaw;
        this.productNameRaw = builder.productNameRaw;
        this.formRaw = builder.formRaw;
        this.lifeStageRaw = builder.lifeStageRaw;
        this.ingredientsRaw = builder.ingredientsRaw;
        this.kcalPer100g = builder.kcalPer100g;
        this.proteinPercent = builder.proteinPercent;
        this.fatPercent = builder.fatPercent;
        this.fiberPercent = builder.fiberPercent;
        this.ashPercent = builder.ashPercent;
        this.moisturePercent = builder.moisturePercent;
        this.price = builder.price;
        this.packSizes = builder.packSizes != null ? List.copyOf(builder.packSizes) : List.of();
        Set<String> countries = new LinkedHashSet<>();
        if (builder.availableCountries != null) {
            for (String country : builder.availableCountries) {
                if (country != null && !country.isBlank()) {
                    countries.add(country.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        this.availableCountries = Collections.unmodifiableSet(countries);
        this.imageUrl = builder.imageUrl;
        this.lastSeenAt = builder.lastSeenAt;
        this.firstSeenAt = builder.firstSeenAt != null ? builder.firstSeenAt : builder.lastSeenAt;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getSourceDomain() {
        return sourceDomain;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public String getBrandRaw() {
        return brandRaw;
    }

    public String getProductNameRaw() {
        return productNameRaw;
    }

    public String getFormRaw() {
        return formRaw;
    }

    public String getLifeStageRaw() {
        return lifeStageRaw;
    }

    public String getIngredientsRaw() {
        return ingredientsRaw;
    }

    public Double getKcalPer100g() {
        return kcalPer100g;
    }

    public Double getProteinPercent() {
        return proteinPercent;
    }

    public Double getFatPercent() {
        return fatPercent;
    }

    public Double getFiberPercent() {
        return fiberPercent;
    }

    public Double getAshPercent() {
        return ashPercent;
    }

    public Double getMoisturePercent() {
        return moisturePercent;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public List<String> getPackSizes() {
        return packSizes;
    }

    public Set<String> getAvailableCountries() {
        return availableCountries;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public boolean hasImage() {
        return imageUrl != null && !imageUrl.isBlank();
    }

    /**
     * Copy of this record re-observed at {@code seenAt}; {@code firstSeenAt} is kept.
     */
    public RawCandidateRecord reobservedAt(Instant seenAt) {
        return toBuilder().lastSeenAt(seenAt).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .sourceId(sourceId)
                .sourceDomain(sourceDomain)
                .sourceUrl(sourceUrl)
                .brandRaw(brandRaw)
                .productNameRaw(productNameRaw)
                .formRaw(formRaw)
                .lifeStageRaw(lifeStageRaw)
                .ingredientsRaw(ingredientsRaw)
                .kcalPer100g(kcalPer100g)
                .proteinPercent(proteinPercent)
                .fatPercent(fatPercent)
                .fiberPercent(fiberPercent)
                .ashPercent(ashPercent)
                .moisturePercent(moisturePercent)
                .price(price)
                .packSizes(packSizes)
                .availableCountries(availableCountries)
                .imageUrl(imageUrl)
                .firstSeenAt(firstSeenAt)
                .lastSeenAt(lastSeenAt);
    }

    /**
     * Every field joined in a fixed order. Two observations with the same fingerprint
     * carry the same data, whatever their arrival order.
     */
    public String contentFingerprint() {
        return String.join("\u0001",
                sourceId, String.valueOf(lastSeenAt), String.valueOf(firstSeenAt),
                String.valueOf(brandRaw), String.valueOf(productNameRaw), String.valueOf(formRaw),
                String.valueOf(lifeStageRaw), String.valueOf(ingredientsRaw),
                String.valueOf(kcalPer100g), String.valueOf(proteinPercent), String.valueOf(fatPercent),
                String.valueOf(fiberPercent), String.valueOf(ashPercent), String.valueOf(moisturePercent),
                price == null ? "null" : price.stripTrailingZeros().toPlainString(),
                String.join(",", packSizes), String.join(",", new TreeSet<>(availableCountries)),
                String.valueOf(imageUrl));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawCandidateRecord that = (RawCandidateRecord) o;
        return Objects.equals(sourceId, that.sourceId)
                && Objects.equals(lastSeenAt, that.lastSeenAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, lastSeenAt);
    }

    @Override
    public String toString() {
        return "RawCandidateRecord{" +
                "sourceId='" + sourceId + '\'' +
                ", brandRaw='" + brandRaw + '\'' +
                ", productNameRaw='" + productNameRaw + '\'' +
                ", formRaw='" + formRaw + '\'' +
                ", lastSeenAt=" + lastSeenAt +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceId;
        private String sourceDomain;
        private String sourceUrl;
        private String brandRaw;
        private String productNameRaw;
        private String formRaw;
        private String lifeStageRaw;
        private String ingredientsRaw;
        private Double kcalPer100g;
        private Double proteinPercent;
        private Double fatPercent;
        private Double fiberPercent;
        private Double ashPercent;
        private Double moisturePercent;
        private BigDecimal price;
        private List<String> packSizes;
        private Set<String> availableCountries;
        private String imageUrl;
        private Instant firstSeenAt;
        private Instant lastSeenAt;

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder sourceDomain(String sourceDomain) {
            this.sourceDomain = sourceDomain;
            return this;
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public Builder brandRaw(String brandRaw) {
            this.brandRaw = brandRaw;
            return this;
        }

        public Builder productNameRaw(String productNameRaw) {
            this.productNameRaw = productNameRaw;
            return this;
        }

        public Builder formRaw(String formRaw) {
            this.formRaw = formRaw;
            return this;
        }

        public Builder lifeStageRaw(String lifeStageRaw) {
            this.lifeStageRaw = lifeStageRaw;
            return this;
        }

        public Builder ingredientsRaw(String ingredientsRaw) {
            this.ingredientsRaw = ingredientsRaw;
            return this;
        }

        public Builder kcalPer100g(Double kcalPer100g) {
            this.kcalPer100g = kcalPer100g;
            return this;
        }

        public Builder proteinPercent(Double proteinPercent) {
            this.proteinPercent = proteinPercent;
            return this;
        }

        public Builder fatPercent(Double fatPercent) {
            this.fatPercent = fatPercent;
            return this;
        }

        public Builder fiberPercent(Double fiberPercent) {
            this.fiberPercent = fiberPercent;
            return this;
        }

        public Builder ashPercent(Double ashPercent) {
            this.ashPercent = ashPercent;
            return this;
        }

        public Builder moisturePercent(Double moisturePercent) {
            this.moisturePercent = moisturePercent;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder packSizes(List<String> packSizes) {
            this.packSizes = packSizes;
            return this;
        }

        public Builder availableCountries(Set<String> availableCountries) {
            this.availableCountries = availableCountries;
            return this;
        }

        public Builder imageUrl(String imageUrl) {
            this.imageUrl = imageUrl;
            return this;
        }

        public Builder firstSeenAt(Instant firstSeenAt) {
            this.firstSeenAt = firstSeenAt;
            return this;
        }

        public Builder lastSeenAt(Instant lastSeenAt) {
            this.lastSeenAt = lastSeenAt;
            return this;
        }

        public RawCandidateRecord build() {
            return new RawCandidateRecord(this);
        }
    }
}
