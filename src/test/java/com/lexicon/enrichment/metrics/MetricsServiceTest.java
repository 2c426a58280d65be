package com.lexicon.enrichment.metrics;

import com.lexicon.enrichment.core.model.WorkStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordOracleCall("ollama", "success", Duration.ofMillis(100));
                noOp.incrementOracleRetry();
                noOp.incrementWorkItem(WorkStatus.COMPLETED);
                noOp.recordHighlightUpsert("inserted");
                noOp.recordResolution("exact");
                noOp.recordClusterSize(3);
                noOp.recordBatchSize(3);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should time oracle calls per provider and outcome")
        void oracleCalls() {
            metrics.recordOracleCall("ollama", "success", Duration.ofMillis(150));
            metrics.recordOracleCall("ollama", "success", Duration.ofMillis(250));
            metrics.recordOracleCall("ollama", "rate_limited", Duration.ofMillis(10));

            Timer success = registry.find("enrichment.oracle.call")
                    .tag("provider", "ollama")
                    .tag("outcome", "success")
                    .timer();

            assertNotNull(success);
            assertEquals(2, success.count());
            assertEquals(400, success.totalTime(TimeUnit.MILLISECONDS), 1.0);
            assertEquals(1, registry.find("enrichment.oracle.call").tag("outcome", "rate_limited").timer().count());
        }

        @Test
        @DisplayName("Should count work items by lower-case status")
        void workItems() {
            metrics.incrementWorkItem(WorkStatus.COMPLETED);
            metrics.incrementWorkItem(WorkStatus.COMPLETED);
            metrics.incrementWorkItem(WorkStatus.ERROR);

            Counter completed = registry.find("enrichment.workitem").tag("status", "completed").counter();
            assertNotNull(completed);
            assertEquals(2.0, completed.count());
            assertEquals(1.0, registry.find("enrichment.workitem").tag("status", "error").counter().count());
        }

        @Test
        @DisplayName("Should count highlight upserts and resolutions by tag")
        void taggedCounters() {
            metrics.recordHighlightUpsert("kept_existing");
            metrics.recordResolution("desuffix");
            metrics.recordResolution("desuffix");

            assertEquals(1.0, registry.find("enrichment.highlight.upsert").tag("outcome", "kept_existing")
                    .counter().count());
            assertEquals(2.0, registry.find("enrichment.resolution").tag("strategy", "desuffix")
                    .counter().count());
        }

        @Test
        @DisplayName("Should record distributions, retries and cache counters")
        void summaries() {
            metrics.recordClusterSize(3);
            metrics.recordClusterSize(1);
            metrics.recordBatchSize(3);
            metrics.incrementOracleRetry();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            DistributionSummary clusters = registry.find("enrichment.cluster.size").summary();
            assertNotNull(clusters);
            assertEquals(2, clusters.count());
            assertEquals(4.0, clusters.totalAmount());
            assertEquals(1, registry.find("enrichment.batch.size").summary().count());
            assertEquals(1.0, registry.find("enrichment.oracle.retry").counter().count());
            assertEquals(1.0, registry.find("enrichment.cache.hit").counter().count());
            assertEquals(2.0, registry.find("enrichment.cache.miss").counter().count());
        }
    }
}
