package com.catalog.reconciliation.core.model;

import java.util.Objects;

/**
 * Natural identity of a product: canonical brand, normalized name and form.
 *
 * @param brandSlug canonical brand slug, e.g. {@code royal_canin}
 * @param nameSlug  hyphenated normalized product name, e.g. {@code adult-15kg}
 * @param form      normalized form, or {@code any}
 */
public record CanonicalKey(String brandSlug, String nameSlug, String form) {

    public static final String SEPARATOR = "::";
    public static final String ANY_FORM = "any";

    public CanonicalKey {
        Objects.requireNonNull(brandSlug, "brandSlug is required");
        Objects.requireNonNull(nameSlug, "nameSlug is required");
        form = form == null || form.isBlank() ? ANY_FORM : form;
    }

    /**
     * {@code brand_slug::name_slug::form}
     */
    public String productKey() {
        return brandSlug + SEPARATOR + nameSlug + SEPARATOR + form;
    }

    @Override
    public String toString() {
        return productKey();
    }
}
