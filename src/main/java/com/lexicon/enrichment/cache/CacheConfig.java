package com.lexicon.enrichment.cache;

/**
 * Resolution cache settings.
 *
 * @param maxSize    maximum number of cached references
 * @param ttlSeconds time-to-live of an entry
 * @param enabled    whether caching is on
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 50,000 entries for 30 minutes: a dictionary import resolves each reference many times.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, 1800, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
