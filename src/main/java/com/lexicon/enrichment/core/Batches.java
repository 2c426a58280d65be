package com.lexicon.enrichment.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits lists into fixed-size chunks.
 */
public final class Batches {

    private Batches() {
    }

    /**
     * Consecutive chunks of at most {@code size} elements; the last chunk may be shorter.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be > 0");
        }
        List<List<T>> chunks = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            chunks.add(List.copyOf(items.subList(from, Math.min(from + size, items.size()))));
        }
        return chunks;
    }
}
