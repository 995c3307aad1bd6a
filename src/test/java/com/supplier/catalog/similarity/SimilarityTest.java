package com.supplier.catalog.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Product name similarity")
class SimilarityTest {

    @Nested
    @DisplayName("JaccardSimilarity")
    class JaccardTests {
        private final JaccardSimilarity jaccard = new JaccardSimilarity();

        @Test
        @DisplayName("Should ignore word order")
        void testWordOrder() {
            assertEquals(1.0, jaccard.compute("gauze swabs 10x10cm", "10x10cm gauze swabs"));
        }

        @Test
        @DisplayName("Should divide shared tokens by the union")
        void testPartialOverlap() {
            // shared {gauze, swabs}, union {gauze, swabs, 10x10cm, 5x5cm}
            assertEquals(0.5, jaccard.compute("gauze swabs 10x10cm", "gauze swabs 5x5cm"), 1e-9);
        }

        @Test
        @DisplayName("Should return zero for null or empty input")
        void testNullAndEmpty() {
            assertEquals(0.0, jaccard.compute(null, "a"));
            assertEquals(0.0, jaccard.compute("", "a"));
        }
    }

    @Nested
    @DisplayName("LevenshteinSimilarity")
    class LevenshteinTests {
        private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();

        @Test
        @DisplayName("Should compute edit distance")
        void testDistance() {
            assertEquals(3, LevenshteinSimilarity.distance("kitten", "sitting"));
            assertEquals(0, LevenshteinSimilarity.distance("same", "same"));
            assertEquals(4, LevenshteinSimilarity.distance("", "four"));
        }

        @Test
        @DisplayName("Should normalize by the longer length")
        void testSimilarity() {
            assertEquals(1.0 - 3.0 / 7.0, levenshtein.compute("kitten", "sitting"), 1e-9);
            assertEquals(1.0, levenshtein.compute("abc", "abc"));
            assertEquals(0.0, levenshtein.compute("", "abc"));
        }
    }

    @Nested
    @DisplayName("CompositeSimilarityScorer")
    class CompositeTests {
        private final CompositeSimilarityScorer scorer = new CompositeSimilarityScorer();

        @Test
        @DisplayName("Should blend token and edit scores with default weights")
        void testBlend() {
            CompositeSimilarityScorer.SimilarityBreakdown breakdown =
                    scorer.computeWithBreakdown("gauze swabs 10x10cm", "gauze swabs 5x5cm");
            double expected = 0.6 * breakdown.tokenScore() + 0.4 * breakdown.editScore();
            assertEquals(expected, breakdown.compositeScore(), 1e-9);
            assertTrue(breakdown.compositeScore() > 0.5);
            assertTrue(breakdown.compositeScore() < 1.0);
        }

        @Test
        @DisplayName("Should score identical labels as 1.0")
        void testIdentical() {
            assertEquals(1.0, scorer.compute("nitrile gloves m", "nitrile gloves m"));
        }

        @Test
        @DisplayName("Should stay within [0, 1]")
        void testBounds() {
            double score = scorer.compute("alpha", "omega beta");
            assertTrue(score >= 0.0 && score <= 1.0);
        }
    }

    @Nested
    @DisplayName("SimilarityWeights")
    class WeightsTests {

        @Test
        @DisplayName("Should reject weights that do not sum to 1.0")
        void testInvalidSum() {
            assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(0.5, 0.6));
            assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(-0.1, 1.1));
        }

        @Test
        @DisplayName("Should expose presets")
        void testPresets() {
            assertEquals(0.6, SimilarityWeights.defaultWeights().tokenWeight());
            assertEquals(0.7, SimilarityWeights.editDistanceFocused().editWeight());
        }
    }

    @Nested
    @DisplayName("TokenBlockingKeyStrategy")
    class BlockingTests {
        private final TokenBlockingKeyStrategy strategy = new TokenBlockingKeyStrategy();

        @Test
        @DisplayName("Should drop short tokens unless they carry a digit")
        void testShortTokens() {
            Set<String> keys = strategy.generateKeys("gauze 5x pcs of m");
            assertEquals(Set.of("tok:gauze", "tok:5x", "tok:pcs"), keys);
        }

        @Test
        @DisplayName("Should return no keys for blank input")
        void testBlank() {
            assertTrue(strategy.generateKeys(" ").isEmpty());
            assertTrue(strategy.generateKeys(null).isEmpty());
        }

        @Test
        @DisplayName("Should validate minimum token length")
        void testMinLength() {
            assertThrows(IllegalArgumentException.class, () -> new TokenBlockingKeyStrategy(0));
            assertEquals(Set.of("tok:of", "tok:gauze"), new TokenBlockingKeyStrategy(2).generateKeys("of gauze m"));
        }
    }
}
