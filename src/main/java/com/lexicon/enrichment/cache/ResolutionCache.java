package com.lexicon.enrichment.cache;

import com.lexicon.enrichment.resolution.ResolutionOutcome;

import java.util.Optional;

/**
 * Memoizes cascade outcomes, misses included, keyed by the raw reference.
 * Must be invalidated whenever concepts or terms are written.
 */
public interface ResolutionCache {

    Optional<ResolutionOutcome> get(String term);

    void put(String term, ResolutionOutcome outcome);

    void invalidateAll();

    CacheStats getStats();
}
