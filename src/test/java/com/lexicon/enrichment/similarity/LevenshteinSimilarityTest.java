package com.lexicon.enrichment.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LevenshteinSimilarity Tests")
class LevenshteinSimilarityTest {

    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

    @Test
    @DisplayName("Should return 1.0 for identical strings")
    void identical() {
        assertEquals(1.0, similarity.compute("hus", "hus"));
        assertEquals(1.0, similarity.compute("", ""));
    }

    @Test
    @DisplayName("Should return 0.0 when one side is empty or null")
    void emptyOrNull() {
        assertEquals(0.0, similarity.compute("", "hus"));
        assertEquals(0.0, similarity.compute(null, "hus"));
    }

    @Test
    @DisplayName("Should normalize the edit distance by the longer length")
    void normalized() {
        assertEquals(0.75, similarity.compute("huus", "hus"), 1e-9);
        assertEquals(1.0 - 3.0 / 7.0, similarity.compute("kitten", "sitting"), 1e-9);
    }

    @Test
    @DisplayName("Should count code points, not chars")
    void codePoints() {
        assertEquals(0.75, similarity.compute("sünn", "sonn"), 1e-9);
    }

    @Test
    @DisplayName("Should agree with compute for threshold checks")
    void atLeastMatchesCompute() {
        String[][] pairs = {{"to the hus", "to the huus"}, {"hog", "hoggwash"}, {"wat", "wet"}, {"a", "abcdefgh"}};
        for (String[] pair : pairs) {
            for (double threshold : new double[]{0.3, 0.7, 0.8, 0.95}) {
                assertEquals(similarity.compute(pair[0], pair[1]) >= threshold,
                        similarity.atLeast(pair[0], pair[1], threshold),
                        pair[0] + " / " + pair[1] + " @ " + threshold);
            }
        }
    }

    @Test
    @DisplayName("Should be symmetric")
    void symmetric() {
        assertEquals(similarity.compute("Hoggwash", "Hog"), similarity.compute("Hog", "Hoggwash"));
    }
}
