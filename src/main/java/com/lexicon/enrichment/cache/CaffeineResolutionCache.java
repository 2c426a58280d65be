package com.lexicon.enrichment.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.lexicon.enrichment.resolution.ResolutionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed resolution cache.
 */
public class CaffeineResolutionCache implements ResolutionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResolutionCache.class);

    private final Cache<String, ResolutionOutcome> cache;

    public CaffeineResolutionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<ResolutionOutcome> get(String term) {
        return Optional.ofNullable(cache.getIfPresent(term));
    }

    @Override
    public void put(String term, ResolutionOutcome outcome) {
        cache.put(term, outcome);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }
}
