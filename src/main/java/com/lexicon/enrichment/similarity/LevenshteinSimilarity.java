package com.lexicon.enrichment.similarity;

/**
 * Normalized edit-distance similarity: {@code 1 - distance / max(length)}, over Unicode code points.
 * Two empty strings are identical; an empty and a non-empty string share nothing.
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        int[] a = s1.codePoints().toArray();
        int[] b = s2.codePoints().toArray();
        if (a.length == 0 || b.length == 0) {
            return 0.0;
        }
        return 1.0 - (double) distance(a, b) / Math.max(a.length, b.length);
    }

    @Override
    public boolean atLeast(String s1, String s2, double threshold) {
        if (s1 == null || s2 == null) {
            return threshold <= 0.0;
        }
        int longer = Math.max(s1.codePointCount(0, s1.length()), s2.codePointCount(0, s2.length()));
        int shorter = Math.min(s1.codePointCount(0, s1.length()), s2.codePointCount(0, s2.length()));
        // the distance is at least the length difference
        if (longer > 0 && 1.0 - (double) (longer - shorter) / longer < threshold) {
            return false;
        }
        return compute(s1, s2) >= threshold;
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Edit distance between two strings counted in code points.
     */
    public static int distance(String s1, String s2) {
        return distance(s1.codePoints().toArray(), s2.codePoints().toArray());
    }

    private static int distance(int[] a, int[] b) {
        if (a.length > b.length) {
            int[] swap = a;
            a = b;
            b = swap;
        }
        int[] previous = new int[a.length + 1];
        int[] current = new int[a.length + 1];
        for (int i = 0; i <= a.length; i++) {
            previous[i] = i;
        }
        for (int j = 1; j <= b.length; j++) {
            current[0] = j;
            for (int i = 1; i <= a.length; i++) {
                int substitution = previous[i - 1] + (a[i - 1] == b[j - 1] ? 0 : 1);
                current[i] = Math.min(Math.min(current[i - 1], previous[i]) + 1, substitution);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[a.length];
    }
}
