package com.catalog.reconciliation.key;

import com.catalog.reconciliation.core.model.CanonicalKey;
import com.catalog.reconciliation.rules.DefaultNameRules;
import com.catalog.reconciliation.rules.PackSizeStripping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProductKeyBuilder Tests")
class ProductKeyBuilderTest {

    private final ProductKeyBuilder builder = new ProductKeyBuilder();

    @Test
    @DisplayName("Should build brand::name::form")
    void buildsKey() {
        CanonicalKey key = builder.buildKey("royal_canin", "Adult 15kg", "dry");

        assertEquals("royal_canin::adult-15kg::dry", key.productKey());
    }

    @Test
    @DisplayName("Missing form should become 'any'")
    void missingForm() {
        assertEquals("acana::wild-prairie::any", builder.buildKey("acana", "Wild Prairie", null).productKey());
    }

    @Test
    @DisplayName("Spacing of a single weight should not change the key")
    void joinsUnits() {
        assertEquals(builder.nameSlug("Adult 15kg"), builder.nameSlug("Adult 15 kg"));
    }

    @Test
    @DisplayName("Bracketed sizes are unwrapped")
    void bracketedSize() {
        assertEquals("adult-15kg", builder.nameSlug("Adult (15kg)"));
    }

    @Test
    @DisplayName("Multipacks are dropped by default")
    void dropsMultipack() {
        assertEquals("adult-chicken", builder.nameSlug("Adult Chicken 12 x 85g"));
    }

    @Test
    @DisplayName("ALL stripping should drop single weights too")
    void stripsAllSizes() {
        ProductKeyBuilder stripping = new ProductKeyBuilder(DefaultNameRules.DEFAULT_STOP_LIST, PackSizeStripping.ALL);

        assertEquals("adult", stripping.nameSlug("Adult 15kg"));
    }

    @Test
    @DisplayName("Stop-list words should be removed as whole words only")
    void stopList() {
        assertEquals("adult-lamb", builder.nameSlug("Complete Adult Lamb Recipe"));
        assertEquals("newfoundland-adult", builder.nameSlug("Newfoundland Adult"));
    }

    @Test
    @DisplayName("Custom stop list replaces the default one")
    void customStopList() {
        ProductKeyBuilder custom = new ProductKeyBuilder(List.of("grain free"), PackSizeStripping.MULTIPACK_ONLY);

        assertEquals("complete-salmon", custom.nameSlug("Complete Grain Free Salmon"));
    }

    @Test
    @DisplayName("Empty names should give a stable placeholder")
    void emptyName() {
        assertEquals("unnamed", builder.nameSlug(""));
        assertEquals("unnamed", builder.nameSlug("Premium Formula"));
    }

    @Test
    @DisplayName("Punctuation and apostrophes should not leak into the slug")
    void punctuation() {
        assertEquals("chefs-choice-lamb-rice", builder.nameSlug("Chef's Choice - Lamb & Rice"));
    }

    @Test
    @DisplayName("Same inputs should always give the same key")
    void deterministic() {
        CanonicalKey first = builder.buildKey("hills", "Adult Lamb & Rice 2.5kg", "dry");
        CanonicalKey second = new ProductKeyBuilder().buildKey("hills", "Adult Lamb & Rice 2.5kg", "dry");

        assertEquals(first, second);
        assertEquals("hills::adult-lamb-rice-2.5kg::dry", first.productKey());
    }
}
