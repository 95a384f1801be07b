package com.catalog.reconciliation.rules;

import com.catalog.reconciliation.core.model.BrandConfidence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BrandCanonicalizer Tests")
class BrandCanonicalizerTest {

    private final BrandCanonicalizer canonicalizer = new BrandCanonicalizer();
    private final BrandAliasMap aliases = DefaultBrandAliases.create();

    @Nested
    @DisplayName("Split-brand repair")
    class SplitBrand {

        @Test
        @DisplayName("Should move the leaked fragment back into the brand")
        void repairsRoyalCanin() {
            BrandResolution result = canonicalizer.canonicalize("Royal", "Canin Adult 15kg", aliases);

            assertEquals("royal_canin", result.brandSlug());
            assertEquals("Adult 15kg", result.cleanedName());
            assertEquals("Royal Canin", result.brandDisplay());
            assertEquals(BrandConfidence.HIGH, result.confidence());
        }

        @Test
        @DisplayName("Split and full spellings should give the same brand and name")
        void splitAndFullAgree() {
            BrandResolution split = canonicalizer.canonicalize("Royal", "Canin Adult 15kg", aliases);
            BrandResolution full = canonicalizer.canonicalize("Royal Canin", "Adult 15kg", aliases);

            assertEquals(full.brandSlug(), split.brandSlug());
            assertEquals(full.cleanedName(), split.cleanedName());
        }

        @Test
        @DisplayName("Should pick up a product line from the name")
        void resolvesLine() {
            BrandResolution result = canonicalizer.canonicalize("Hills", "Science Plan Adult", aliases);

            assertEquals("hills", result.brandSlug());
            assertEquals("science_plan", result.brandLine());
            assertEquals("Adult", result.cleanedName());
        }
    }

    @Nested
    @DisplayName("Whole-word matching")
    class WholeWord {

        @Test
        @DisplayName("'Canine' must not match the alias 'Royal Canin'")
        void canineIsNotCanin() {
            BrandResolution result = canonicalizer.canonicalize("Royal", "Canine Adult", aliases);

            assertEquals("royal", result.brandSlug());
            assertEquals("Canine Adult", result.cleanedName());
            assertEquals(BrandConfidence.LOW, result.confidence());
            assertFalse(result.isResolved());
        }

        @Test
        @DisplayName("Denylisted phrase in the brand column stays unresolved")
        void denylistedBrand() {
            BrandResolution result = canonicalizer.canonicalize("Royal Canine", "Adult", aliases);

            assertEquals("royal_canine", result.brandSlug());
            assertEquals(BrandConfidence.LOW, result.confidence());
            assertNull(result.matchedAlias());
        }

        @Test
        @DisplayName("Longest alias should win over a shorter prefix")
        void longestAliasFirst() {
            BrandResolution result = canonicalizer.canonicalize("Purina Pro Plan", "Medium Adult", aliases);

            assertEquals("purina", result.brandSlug());
            assertEquals("pro_plan", result.brandLine());
            assertEquals("Medium Adult", result.cleanedName());
        }
    }

    @Nested
    @DisplayName("Brand column variants")
    class Variants {

        @Test
        @DisplayName("Should move the rest of a long brand column into the name")
        void remainderOfBrandMovesToName() {
            BrandResolution result = canonicalizer.canonicalize("Purina Pro Plan Sensitive", "Salmon", aliases);

            assertEquals("purina", result.brandSlug());
            assertEquals("Sensitive Salmon", result.cleanedName());
        }

        @Test
        @DisplayName("Should strip a brand repeated at the start of the name")
        void stripsRepeatedBrand() {
            BrandResolution result = canonicalizer.canonicalize("Acana", "Acana Wild Prairie", aliases);

            assertEquals("acana", result.brandSlug());
            assertEquals("Wild Prairie", result.cleanedName());
        }

        @Test
        @DisplayName("Typographic apostrophes should match plain ones")
        void typographicApostrophe() {
            BrandResolution result = canonicalizer.canonicalize("Hill’s", "Adult Lamb", aliases);

            assertEquals("hills", result.brandSlug());
            assertEquals("Adult Lamb", result.cleanedName());
        }

        @Test
        @DisplayName("Brand only in the name should still resolve")
        void brandOnlyInName() {
            BrandResolution result = canonicalizer.canonicalize(null, "Royal Canin Mini Adult", aliases);

            assertEquals("royal_canin", result.brandSlug());
            assertEquals("Mini Adult", result.cleanedName());
        }

        @Test
        @DisplayName("No brand at all should give the unknown slug")
        void emptyBrand() {
            BrandResolution result = canonicalizer.canonicalize("", "Chicken Bites", aliases);

            assertEquals("unknown", result.brandSlug());
            assertEquals("Chicken Bites", result.cleanedName());
            assertEquals(BrandConfidence.LOW, result.confidence());
        }
    }

    @ParameterizedTest
    @DisplayName("Canonicalizing an output again should not change it")
    @CsvSource({
            "Royal, Canin Adult 15kg",
            "Royal Canin, Adult 15kg",
            "Hills, Science Plan Adult",
            "Purina Pro Plan Sensitive, Salmon",
            "Hills Science Plan, Adult Chicken",
            "Purina ONE, Adult Chicken",
            "Unknown Farm, Lamb Biscuits"
    })
    void idempotent(String brandRaw, String nameRaw) {
        BrandResolution first = canonicalizer.canonicalize(brandRaw, nameRaw, aliases);
        BrandResolution second = canonicalizer.canonicalize(
                first.brandSlug(), first.brandLine(), first.cleanedName(), aliases);

        assertEquals(first.brandSlug(), second.brandSlug());
        assertEquals(first.brandLine(), second.brandLine());
        if (first.isResolved()) {
            assertEquals(first.cleanedName(), second.cleanedName());
        }
    }

    @Nested
    @DisplayName("Canonical slug input")
    class SlugInput {

        @Test
        @DisplayName("A supplied line passes through with the name untouched")
        void keepsSuppliedLine() {
            BrandResolution result = canonicalizer.canonicalize("hills", "science_plan", "Adult Chicken", aliases);

            assertEquals("hills", result.brandSlug());
            assertEquals("science_plan", result.brandLine());
            assertEquals("Adult Chicken", result.cleanedName());
            assertEquals("Hill's", result.brandDisplay());
        }

        @Test
        @DisplayName("A line phrase opening the name is recovered")
        void recoversLineFromName() {
            BrandResolution result = canonicalizer.canonicalize("hills", "Science Plan Adult", aliases);

            assertEquals("science_plan", result.brandLine());
            assertEquals("Adult", result.cleanedName());
        }

        @Test
        @DisplayName("A line of another brand is not taken")
        void ignoresForeignLine() {
            BrandResolution result = canonicalizer.canonicalize("acana", "Pro Plan Adult", aliases);

            assertNull(result.brandLine());
            assertEquals("Pro Plan Adult", result.cleanedName());
        }
    }

    @Test
    @DisplayName("Unresolved brands are slugged from the raw text")
    void unresolvedSlug() {
        BrandResolution result = canonicalizer.canonicalize("Happy Dog", "Adult", aliases);

        assertEquals("happy_dog", result.brandSlug());
        assertEquals("Happy Dog", result.brandDisplay());
        assertEquals(BrandConfidence.LOW, result.confidence());
    }
}
