package com.lexicon.enrichment.metrics;

import com.lexicon.enrichment.core.model.WorkStatus;

import java.time.Duration;

/**
 * Records pipeline metrics. {@link NoOpMetricsService} is the default,
 * so the library runs without a metrics backend.
 */
public interface MetricsService {

    /**
     * @param outcome {@code success}, {@code rate_limited}, {@code invalid_response}, {@code timeout} or {@code error}
     */
    void recordOracleCall(String provider, String outcome, Duration duration);

    void incrementOracleRetry();

    /**
     * Counts a work item reaching a terminal status.
     */
    void incrementWorkItem(WorkStatus status);

    /**
     * @param outcome name of the highlight upsert outcome
     */
    void recordHighlightUpsert(String outcome);

    /**
     * @param strategy name of the matching strategy, or {@code unresolved}
     */
    void recordResolution(String strategy);

    void recordClusterSize(int size);

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
