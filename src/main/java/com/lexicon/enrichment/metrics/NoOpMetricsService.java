package com.lexicon.enrichment.metrics;

import com.lexicon.enrichment.core.model.WorkStatus;

import java.time.Duration;

/**
 * Discards all metrics.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordOracleCall(String provider, String outcome, Duration duration) {
    }

    @Override
    public void incrementOracleRetry() {
    }

    @Override
    public void incrementWorkItem(WorkStatus status) {
    }

    @Override
    public void recordHighlightUpsert(String outcome) {
    }

    @Override
    public void recordResolution(String strategy) {
    }

    @Override
    public void recordClusterSize(int size) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
