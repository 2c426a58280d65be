package com.lexicon.enrichment.cache;

import com.lexicon.enrichment.resolution.ResolutionOutcome;

import java.util.Optional;

/**
 * Cache that never holds anything. Used when caching is disabled.
 */
public class NoOpResolutionCache implements ResolutionCache {

    @Override
    public Optional<ResolutionOutcome> get(String term) {
        return Optional.empty();
    }

    @Override
    public void put(String term, ResolutionOutcome outcome) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
