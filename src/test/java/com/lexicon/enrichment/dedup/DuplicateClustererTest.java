package com.lexicon.enrichment.dedup;

import com.lexicon.enrichment.core.model.Cluster;
import com.lexicon.enrichment.core.model.LexicalRecord;
import com.lexicon.enrichment.similarity.LevenshteinSimilarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DuplicateClusterer Tests")
class DuplicateClustererTest {

    private final DuplicateClusterer clusterer = new DuplicateClusterer();

    private static LexicalRecord record(String id, String term, String explanation) {
        return new LexicalRecord(id, term, null, explanation, "idiom", "idioms");
    }

    @Nested
    @DisplayName("Duplicate rules")
    class Rules {

        @Test
        @DisplayName("Should cluster Hog with Hog/Pig and keep Hoggwash apart")
        void hogScenario() {
            List<Cluster> clusters = clusterer.cluster(List.of(
                    record("1", "Hog", "a pig"),
                    record("2", "Hog/Pig", "a pig, any pig"),
                    record("3", "Hoggwash", "nonsense")));

            assertEquals(2, clusters.size());
            assertEquals(List.of("1", "2"), clusters.get(0).memberIds());
            assertEquals(List.of("3"), clusters.get(1).memberIds());
        }

        @Test
        @DisplayName("Should treat keys equal after normalization as duplicates")
        void equalKeys() {
            assertTrue(clusterer.similar(record("1", "  Dat   Hus ", null), record("2", "dat hus", null)));
        }

        @Test
        @DisplayName("Should require both key and explanation similarity for fuzzy matches")
        void fuzzyNeedsExplanation() {
            LexicalRecord a = record("1", "to the hus", "going home after work");
            LexicalRecord sameMeaning = record("2", "to the huus", "going home after work");
            LexicalRecord otherMeaning = record("3", "to the huus", "a storm at sea");

            assertTrue(clusterer.similar(a, sameMeaning));
            assertFalse(clusterer.similar(a, otherMeaning));
        }

        @Test
        @DisplayName("Should never match a blank key")
        void blankKeyNeverMatches() {
            assertFalse(clusterer.similar(record("1", " ", null), record("2", " ", null)));
        }

        @Test
        @DisplayName("Should be symmetric")
        void symmetric() {
            List<LexicalRecord> records = sample();
            for (LexicalRecord a : records) {
                for (LexicalRecord b : records) {
                    assertEquals(clusterer.similar(a, b), clusterer.similar(b, a),
                            () -> "asymmetric for '" + a.term() + "' and '" + b.term() + "'");
                }
            }
        }
    }

    @Nested
    @DisplayName("Partition")
    class Partition {

        @Test
        @DisplayName("Should place every record in exactly one cluster")
        void everyRecordOnce() {
            List<LexicalRecord> records = sample();

            List<Cluster> clusters = clusterer.cluster(records);

            List<String> ids = new ArrayList<>();
            clusters.forEach(c -> ids.addAll(c.memberIds()));
            assertEquals(records.size(), ids.size());
            assertEquals(records.stream().map(LexicalRecord::id).collect(java.util.stream.Collectors.toSet()),
                    new HashSet<>(ids));
        }

        @Test
        @DisplayName("Should join explanations of a cluster in member order")
        void mergedExplanation() {
            List<Cluster> clusters = clusterer.cluster(List.of(
                    record("1", "Hog", "a pig"),
                    record("2", "hog", " "),
                    record("3", "HOG", "a swine")));

            assertEquals(1, clusters.size());
            assertEquals("a pig ++ a swine", clusters.get(0).mergedExplanation());
        }

        @Test
        @DisplayName("Should reject input larger than the chunk size")
        void rejectsOversizedChunk() {
            DuplicateClusterer small = new DuplicateClusterer(new ClusteringPolicy(0.8, 0.7, 2),
                    new LevenshteinSimilarity());

            assertThrows(IllegalArgumentException.class, () -> small.cluster(sample()));
        }

        @Test
        @DisplayName("Should return no clusters for no records")
        void empty() {
            assertTrue(clusterer.cluster(List.of()).isEmpty());
        }
    }

    @Test
    @DisplayName("Should find a needle only between delimiters")
    void containsBounded() {
        assertTrue(DuplicateClusterer.containsBounded("hog/pig", "hog"));
        assertTrue(DuplicateClusterer.containsBounded("the (hog)", "hog"));
        assertTrue(DuplicateClusterer.containsBounded("a hog; a pig", "a pig"));
        assertFalse(DuplicateClusterer.containsBounded("hoggwash", "hog"));
        assertFalse(DuplicateClusterer.containsBounded("hog", "hoggwash"));
    }

    @Test
    @DisplayName("Should validate policy thresholds")
    void policyValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ClusteringPolicy(0.0, 0.7, 10));
        assertThrows(IllegalArgumentException.class, () -> new ClusteringPolicy(0.8, 1.5, 10));
        assertThrows(IllegalArgumentException.class, () -> new ClusteringPolicy(0.8, 0.7, 0));
    }

    private static List<LexicalRecord> sample() {
        return List.of(
                record("1", "Hog", "a pig"),
                record("2", "Hog/Pig", "a pig"),
                record("3", "Hoggwash", "nonsense"),
                record("4", "to the hus", "going home"),
                record("5", "to the huus", "going home"),
                record("6", "Sünn skiin", "sunshine"),
                record("7", "sünn skiin", null),
                record("8", "Wat'n Wedder", "what weather"),
                record("9", "wat en wedder", "what weather"),
                record("10", "Pig", "a pig"));
    }
}
