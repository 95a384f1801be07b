package com.catalog.reconciliation.core.model;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Locale;

/**
 * Fields of a {@link CanonicalProduct} that carry per-field provenance.
 * The wire name is the snake_case form used in exports and override tables.
 */
public enum CatalogField {
    BRAND(String.class),
    BRAND_LINE(String.class),
    PRODUCT_NAME(String.class),
    FORM(String.class),
    LIFE_STAGE(String.class),
    KCAL_PER_100G(Double.class),
    PROTEIN_PERCENT(Double.class),
    FAT_PERCENT(Double.class),
    FIBER_PERCENT(Double.class),
    ASH_PERCENT(Double.class),
    MOISTURE_PERCENT(Double.class),
    INGREDIENTS_RAW(String.class),
    INGREDIENTS_TOKENS(Collection.class),
    PACK_SIZES(Collection.class),
    PRICE_PER_KG(BigDecimal.class),
    PRICE_BUCKET(PriceBucket.class),
    IMAGE_URL(String.class),
    AVAILABLE_COUNTRIES(Collection.class);

    private final Class<?> valueType;

    CatalogField(Class<?> valueType) {
        this.valueType = valueType;
    }

    public Class<?> valueType() {
        return valueType;
    }

    /**
     * Whether {@code value} can be stored in this field.
     */
    public boolean accepts(Object value) {
        return value == null || valueType.isInstance(value);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up a field by its wire name (case-insensitive).
     *
     * @throws IllegalArgumentException if no field has that name
     */
    public static CatalogField fromWireName(String wireName) {
        if (wireName == null) {
            throw new IllegalArgumentException("field name is required");
        }
        return CatalogField.valueOf(wireName.trim().toUpperCase(Locale.ROOT));
    }
}
