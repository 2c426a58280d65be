package com.lexicon.enrichment.cache;

/**
 * Snapshot of cache counters.
 *
 * @param hitCount      lookups answered from the cache
 * @param missCount     lookups that ran the cascade
 * @param evictionCount entries evicted by size or age
 * @param size          current number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
