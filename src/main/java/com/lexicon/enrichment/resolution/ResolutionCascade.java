package com.lexicon.enrichment.resolution;

import com.lexicon.enrichment.cache.NoOpResolutionCache;
import com.lexicon.enrichment.cache.ResolutionCache;
import com.lexicon.enrichment.metrics.MetricsService;
import com.lexicon.enrichment.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Links freeform references to canonical concepts by trying strategies in order; the first hit wins.
 *
 * <p>A miss is not an error: it is logged, counted, and returned as an empty result.
 * The cascade only reads.</p>
 *
 * <pre>
 * ResolutionCascade cascade = ResolutionCascade.standard(conceptRepository);
 * cascade.resolve("Haus²");            // the id of "Haus"
 * cascade.resolve("Haupt-/Nebeneingang");
 * </pre>
 */
public class ResolutionCascade {
    private static final Logger log = LoggerFactory.getLogger(ResolutionCascade.class);

    static final String UNRESOLVED = "unresolved";

    private final List<ResolutionStrategy> strategies;
    private final ResolutionCache cache;
    private final MetricsService metrics;

    public ResolutionCascade(List<ResolutionStrategy> strategies) {
        this(strategies, new NoOpResolutionCache(), new NoOpMetricsService());
    }

    public ResolutionCascade(List<ResolutionStrategy> strategies, ResolutionCache cache, MetricsService metrics) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * The standard six-strategy cascade without caching.
     */
    public static ResolutionCascade standard(ConceptLookup lookup) {
        return new ResolutionCascade(ResolutionStrategies.standard(lookup, new ReferenceCleaner()));
    }

    public static ResolutionCascade standard(ConceptLookup lookup, ResolutionCache cache, MetricsService metrics) {
        return new ResolutionCascade(ResolutionStrategies.standard(lookup, new ReferenceCleaner()), cache, metrics);
    }

    /**
     * @return the id of the matched concept, or empty when no strategy matched
     */
    public Optional<String> resolve(String term) {
        return Optional.ofNullable(resolveDetailed(term).conceptId());
    }

    /**
     * Like {@link #resolve(String)}, also reporting which strategy matched and on which form.
     */
    public ResolutionOutcome resolveDetailed(String term) {
        if (term == null || term.isBlank()) {
            return ResolutionOutcome.unresolved(term);
        }
        Optional<ResolutionOutcome> cached = cache.get(term);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();

        ResolutionOutcome outcome = runStrategies(term);
        cache.put(term, outcome);
        metrics.recordResolution(outcome.resolved() ? outcome.strategy() : UNRESOLVED);
        if (outcome.resolved()) {
            log.debug("resolution.matched term='{}' strategy={} candidate='{}' conceptId={}",
                    term, outcome.strategy(), outcome.candidate(), outcome.conceptId());
        } else {
            log.warn("resolution.unresolved term='{}'", term);
        }
        return outcome;
    }

    /**
     * Drops memoized outcomes. Call after writing concepts or terms.
     */
    public void invalidate() {
        cache.invalidateAll();
    }

    public List<ResolutionStrategy> getStrategies() {
        return strategies;
    }

    private ResolutionOutcome runStrategies(String term) {
        for (ResolutionStrategy strategy : strategies) {
            Optional<ResolutionStrategy.Match> match = strategy.resolve(term);
            if (match.isPresent()) {
                return new ResolutionOutcome(term, match.get().conceptId(), strategy.name(), match.get().candidate());
            }
        }
        return ResolutionOutcome.unresolved(term);
    }
}
