package com.catalog.resolution.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Trigram similarity Tests")
class TrigramSimilarityTest {

    private final TrigramSimilarity similarity = new TrigramSimilarity();

    @Nested
    @DisplayName("TrigramProfile")
    class ProfileTests {

        @Test
        @DisplayName("Pads each word with two leading spaces and one trailing space")
        void padsWords() {
            assertEquals(Set.of("  p", " pr", "pre", "res", "ess", "ss "),
                    TrigramProfile.of("press").trigrams());
        }

        @Test
        @DisplayName("Single-character words still yield trigrams")
        void shortWords() {
            assertEquals(Set.of("  a", " a "), TrigramProfile.of("a").trigrams());
        }

        @Test
        @DisplayName("Punctuation only separates words")
        void punctuationSeparates() {
            assertEquals(TrigramProfile.of("plate loaded").trigrams(),
                    TrigramProfile.of("(plate-loaded)").trigrams());
        }

        @Test
        @DisplayName("Repeated trigrams are counted once")
        void setSemantics() {
            assertEquals(TrigramProfile.of("row").trigrams(), TrigramProfile.of("row row").trigrams());
        }

        @Test
        @DisplayName("Text without letters or digits has no trigrams")
        void emptyProfile() {
            assertTrue(TrigramProfile.of("!!!").isEmpty());
            assertTrue(TrigramProfile.of("").isEmpty());
            assertTrue(TrigramProfile.of(null).isEmpty());
        }

        @Test
        @DisplayName("Counts shared trigrams")
        void sharedCount() {
            TrigramProfile a = TrigramProfile.of("alpha press");
            TrigramProfile b = TrigramProfile.of("bravo press");
            assertEquals(6, a.sharedCount(b));
            assertTrue(a.sharesAnyWith(b));
            assertFalse(a.sharesAnyWith(TrigramProfile.of("xyzzy")));
        }
    }

    @Nested
    @DisplayName("TrigramSimilarity")
    class ScoreTests {

        @Test
        @DisplayName("Identical strings score 1.0")
        void identical() {
            assertEquals(1.0, similarity.compute("lat pulldown", "lat pulldown"));
        }

        @Test
        @DisplayName("Two empty strings score 1.0")
        void bothEmpty() {
            assertEquals(1.0, similarity.compute("", ""));
        }

        @Test
        @DisplayName("A side without trigrams scores 0.0 against different text")
        void emptySide() {
            assertEquals(0.0, similarity.compute("", "press"));
            assertEquals(0.0, similarity.compute("!!!", "press"));
        }

        @Test
        @DisplayName("Null scores 0.0")
        void nullInput() {
            assertEquals(0.0, similarity.compute(null, "press"));
        }

        @Test
        @DisplayName("Score is shared over union")
        void jaccard() {
            // 6 shared of 12 distinct trigrams
            assertEquals(0.5, similarity.compute("press", "alpha press"), 1e-9);
        }

        @Test
        @DisplayName("Word order does not change the score")
        void wordOrder() {
            assertEquals(1.0, similarity.compute("seated row", "row seated"), 1e-9);
        }

        @Test
        @DisplayName("Score is symmetric and within [0,1]")
        void symmetric() {
            String[] samples = {"chest press", "hammer strength chest press", "lat pull down", "treadmill run", "egg"};
            for (String a : samples) {
                for (String b : samples) {
                    double ab = similarity.compute(a, b);
                    assertEquals(ab, similarity.compute(b, a), 1e-12);
                    assertTrue(ab >= 0.0 && ab <= 1.0);
                }
            }
        }

        @Test
        @DisplayName("Closer text scores higher")
        void ordering() {
            double close = similarity.compute("chest press", "chest press machine");
            double far = similarity.compute("chest press", "treadmill run");
            assertTrue(close > far);
            assertEquals(0.0, far);
        }

        @Test
        @DisplayName("Scorable when equal or sharing a trigram")
        void scorable() {
            TrigramProfile query = TrigramProfile.of("press");
            assertTrue(similarity.isScorable(query, TrigramProfile.of("bench press")));
            assertFalse(similarity.isScorable(query, TrigramProfile.of("treadmill")));
            assertTrue(similarity.isScorable(TrigramProfile.of("!!!"), TrigramProfile.of("!!!")));
        }
    }

    @Nested
    @DisplayName("TrigramBlockingKeyStrategy")
    class BlockingTests {

        private final TrigramBlockingKeyStrategy strategy = new TrigramBlockingKeyStrategy();

        @Test
        @DisplayName("Keys are the trigrams of the text")
        void keysAreTrigrams() {
            assertEquals(TrigramProfile.of("lat pulldown").trigrams(), strategy.generateKeys("lat pulldown"));
        }

        @Test
        @DisplayName("Texts with a positive score always share a key")
        void noFalseNegatives() {
            String[] samples = {"lat pulldown", "pulldown machine", "lat pull down", "seated row", "low row machine"};
            for (String a : samples) {
                for (String b : samples) {
                    if (similarity.compute(a, b) > 0.0) {
                        Set<String> keys = strategy.generateKeys(a);
                        assertTrue(strategy.generateKeys(b).stream().anyMatch(keys::contains),
                                a + " / " + b);
                    }
                }
            }
        }

        @Test
        @DisplayName("Empty text yields no keys")
        void emptyText() {
            assertTrue(strategy.generateKeys("").isEmpty());
        }
    }
}
