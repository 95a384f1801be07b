package com.catalog.reconciliation;

import com.catalog.reconciliation.core.model.CanonicalKey;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.CatalogField;
import com.catalog.reconciliation.core.model.FieldProvenance;

/**
 * Shared merged products for tests.
 */
public final class CanonicalProducts {

    public static final String SOURCE_ID = "shop-b.example|/p/2";

    private CanonicalProducts() {
    }

    /**
     * The reconciled product of the split-brand scenario.
     */
    public static CanonicalProduct royalCaninAdult() {
        return product("royal_canin", "adult-15kg", "dry", "Royal Canin", "Adult 15kg")
                .value(CatalogField.KCAL_PER_100G, 365.0, FieldProvenance.source(SOURCE_ID))
                .build();
    }

    public static CanonicalProduct.Builder product(String brandSlug, String nameSlug, String form,
                                                   String brand, String productName) {
        FieldProvenance origin = FieldProvenance.source(SOURCE_ID);
        return CanonicalProduct.builder()
                .canonicalKey(new CanonicalKey(brandSlug, nameSlug, form))
                .value(CatalogField.BRAND, brand, origin)
                .value(CatalogField.PRODUCT_NAME, productName, origin)
                .value(CatalogField.FORM, form, origin);
    }
}
