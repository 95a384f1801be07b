package com.catalog.reconciliation.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity Tests")
class ProductNameSimilarityTest {

    @Nested
    @DisplayName("JaroWinklerSimilarity")
    class JaroWinkler {

        private final JaroWinklerSimilarity algorithm = new JaroWinklerSimilarity();

        @Test
        @DisplayName("Should score the textbook MARTHA/MARHTA pair")
        void textbookPair() {
            assertEquals(0.961, algorithm.compute("MARTHA", "MARHTA"), 0.001);
        }

        @Test
        @DisplayName("Identical, empty and null inputs")
        void edgeCases() {
            assertEquals(1.0, algorithm.compute("adult", "adult"));
            assertEquals(0.0, algorithm.compute("adult", ""));
            assertEquals(0.0, algorithm.compute(null, "adult"));
            assertEquals(0.0, algorithm.compute("abc", "xyz"));
        }
    }

    @Nested
    @DisplayName("TokenJaccardSimilarity")
    class TokenJaccard {

        private final TokenJaccardSimilarity algorithm = new TokenJaccardSimilarity();

        @Test
        @DisplayName("Should divide shared words by all words")
        void overlap() {
            assertEquals(2.0 / 3.0, algorithm.compute("adult lamb rice", "adult lamb"), 1e-9);
            assertEquals(1.0, algorithm.compute("lamb  adult", "adult lamb"));
            assertEquals(0.0, algorithm.compute("adult", "puppy"));
        }
    }

    @Nested
    @DisplayName("ProductNameSimilarity")
    class ProductName {

        private final ProductNameSimilarity similarity = new ProductNameSimilarity();

        @Test
        @DisplayName("Packaging variants of one product are identical")
        void packagingVariants() {
            assertEquals(1.0, similarity.compute("Adult 15kg", "Adult (2 kg)"));
            assertEquals("adult", similarity.comparable("Adult 12 x 85g"));
        }

        @Test
        @DisplayName("Names that only met through the stop list score below the collision threshold")
        void stopListCollision() {
            double score = similarity.compute("Adult", "New Improved Formula Adult");

            assertTrue(score < 0.75, "score was " + score);
            assertTrue(score > 0.0);
        }

        @Test
        @DisplayName("Custom weights change the blend")
        void customWeights() {
            ProductNameSimilarity jaccardOnly = new ProductNameSimilarity(new NameSimilarityWeights(0.0, 1.0));

            assertEquals(1.0 / 3.0, jaccardOnly.compute("Adult Lamb", "Adult Chicken"), 1e-9);
        }

        @Test
        @DisplayName("Weights must sum to one")
        void invalidWeights() {
            assertThrows(IllegalArgumentException.class, () -> new NameSimilarityWeights(0.5, 0.6));
            assertThrows(IllegalArgumentException.class, () -> new NameSimilarityWeights(-0.5, 1.5));
        }
    }
}
