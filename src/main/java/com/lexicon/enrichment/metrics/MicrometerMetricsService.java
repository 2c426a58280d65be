package com.lexicon.enrichment.metrics;

import com.lexicon.enrichment.core.model.WorkStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code enrichment.oracle.call} Timer (tags: provider, outcome)</li>
 *   <li>{@code enrichment.oracle.retry} Counter</li>
 *   <li>{@code enrichment.workitem} Counter (tag: status)</li>
 *   <li>{@code enrichment.highlight.upsert} Counter (tag: outcome)</li>
 *   <li>{@code enrichment.resolution} Counter (tag: strategy)</li>
 *   <li>{@code enrichment.cluster.size} DistributionSummary</li>
 *   <li>{@code enrichment.batch.size} DistributionSummary</li>
 *   <li>{@code enrichment.cache.hit} and {@code enrichment.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter retryCounter;
    private final DistributionSummary clusterSizeSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.retryCounter = Counter.builder("enrichment.oracle.retry")
                .description("Oracle calls retried after a rate-limit signal")
                .register(registry);
        this.clusterSizeSummary = DistributionSummary.builder("enrichment.cluster.size")
                .description("Number of records per duplicate cluster")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("enrichment.batch.size")
                .description("Number of items per oracle sub-batch")
                .register(registry);
        this.cacheHitCounter = Counter.builder("enrichment.cache.hit")
                .description("Resolution cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("enrichment.cache.miss")
                .description("Resolution cache misses")
                .register(registry);
    }

    @Override
    public void recordOracleCall(String provider, String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(provider + ":" + outcome, k ->
                Timer.builder("enrichment.oracle.call")
                        .description("Duration of oracle calls")
                        .tag("provider", provider)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementOracleRetry() {
        retryCounter.increment();
    }

    @Override
    public void incrementWorkItem(WorkStatus status) {
        counter("workitem:" + status.name(), "enrichment.workitem", "Work items reaching a terminal status",
                "status", status.storageValue()).increment();
    }

    @Override
    public void recordHighlightUpsert(String outcome) {
        counter("highlight:" + outcome, "enrichment.highlight.upsert", "Highlight upserts by outcome",
                "outcome", outcome).increment();
    }

    @Override
    public void recordResolution(String strategy) {
        counter("resolution:" + strategy, "enrichment.resolution", "Reference resolutions by matching strategy",
                "strategy", strategy).increment();
    }

    @Override
    public void recordClusterSize(int size) {
        clusterSizeSummary.record(size);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String key, String name, String description, String tag, String value) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tag, value)
                        .register(registry));
    }
}
