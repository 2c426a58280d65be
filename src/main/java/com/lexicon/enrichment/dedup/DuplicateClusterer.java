package com.lexicon.enrichment.dedup;

import com.lexicon.enrichment.core.model.Cluster;
import com.lexicon.enrichment.core.model.LexicalKeys;
import com.lexicon.enrichment.core.model.LexicalRecord;
import com.lexicon.enrichment.similarity.LevenshteinSimilarity;
import com.lexicon.enrichment.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Greedy single-pass clustering of lexical records.
 *
 * <p>Records are visited in input order. An unassigned record opens a cluster and claims every later
 * unassigned record {@linkplain #similar(LexicalRecord, LexicalRecord) similar} to it. Two records are
 * similar when their normalized keys are equal, when one key occurs inside the other bounded by
 * delimiters, or when both keys and explanations are close in edit distance.</p>
 *
 * <p>Similarity is symmetric but not transitive; the result is always a partition of the input.
 * Work is quadratic in the input size, so inputs above {@link ClusteringPolicy#maxChunkSize()} are rejected.</p>
 */
public class DuplicateClusterer {
    private static final Logger log = LoggerFactory.getLogger(DuplicateClusterer.class);

    private final ClusteringPolicy policy;
    private final SimilarityAlgorithm similarity;

    public DuplicateClusterer() {
        this(ClusteringPolicy.defaults(), new LevenshteinSimilarity());
    }

    public DuplicateClusterer(ClusteringPolicy policy, SimilarityAlgorithm similarity) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
    }

    public ClusteringPolicy getPolicy() {
        return policy;
    }

    /**
     * Partitions the records into clusters.
     *
     * @throws IllegalArgumentException if more than {@code maxChunkSize} records are given
     */
    public List<Cluster> cluster(List<LexicalRecord> records) {
        if (records.size() > policy.maxChunkSize()) {
            throw new IllegalArgumentException("Cannot cluster " + records.size()
                    + " records at once; chunk the input to at most " + policy.maxChunkSize());
        }
        boolean[] assigned = new boolean[records.size()];
        List<Cluster> clusters = new ArrayList<>();

        for (int i = 0; i < records.size(); i++) {
            if (assigned[i]) {
                continue;
            }
            LexicalRecord primary = records.get(i);
            assigned[i] = true;
            List<LexicalRecord> duplicates = new ArrayList<>();
            for (int j = i + 1; j < records.size(); j++) {
                if (!assigned[j] && similar(primary, records.get(j))) {
                    duplicates.add(records.get(j));
                    assigned[j] = true;
                }
            }
            clusters.add(new Cluster(primary, duplicates));
        }

        log.debug("dedup.clustered records={} clusters={}", records.size(), clusters.size());
        return clusters;
    }

    /**
     * Symmetric duplicate test.
     */
    public boolean similar(LexicalRecord a, LexicalRecord b) {
        String keyA = a.normalizedKey();
        String keyB = b.normalizedKey();
        if (keyA.isEmpty() || keyB.isEmpty()) {
            return false;
        }
        if (keyA.equals(keyB)) {
            return true;
        }
        if (containsBounded(keyA, keyB) || containsBounded(keyB, keyA)) {
            return true;
        }
        return similarity.atLeast(keyA, keyB, policy.keyThreshold())
                && similarity.atLeast(LexicalKeys.of(a.explanationOrEmpty()),
                LexicalKeys.of(b.explanationOrEmpty()), policy.explanationThreshold());
    }

    /**
     * Whether {@code needle} occurs in {@code haystack} with a delimiter or the string boundary on both sides.
     * Delimiters are whitespace, {@code / , ; ( )}.
     */
    public static boolean containsBounded(String haystack, String needle) {
        if (needle.isEmpty() || needle.length() > haystack.length()) {
            return false;
        }
        int from = 0;
        while (true) {
            int index = haystack.indexOf(needle, from);
            if (index < 0) {
                return false;
            }
            int end = index + needle.length();
            boolean leftBounded = index == 0 || isDelimiter(haystack.charAt(index - 1));
            boolean rightBounded = end == haystack.length() || isDelimiter(haystack.charAt(end));
            if (leftBounded && rightBounded) {
                return true;
            }
            from = index + 1;
        }
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '/' || c == ',' || c == ';' || c == '(' || c == ')';
    }
}
