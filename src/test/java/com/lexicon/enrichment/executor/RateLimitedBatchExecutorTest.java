package com.lexicon.enrichment.executor;

import com.lexicon.enrichment.ledger.LedgerException;
import com.lexicon.enrichment.metrics.NoOpMetricsService;
import com.lexicon.enrichment.oracle.OracleException;
import com.lexicon.enrichment.oracle.RateLimitedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RateLimitedBatchExecutor Tests")
class RateLimitedBatchExecutorTest {

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private RateLimitedBatchExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.close();
        }
    }

    private RateLimitedBatchExecutor executor(ExecutorConfig.Builder config) {
        executor = new RateLimitedBatchExecutor(config.build(), sleeper,
                new NoOpMetricsService());
        return executor;
    }

    private static List<Integer> items(int count) {
        return IntStream.range(0, count).boxed().toList();
    }

    /**
     * Handler running a body per sub-batch and recording failures.
     */
    private static final class Recorder implements SubBatchHandler<Integer> {
        private final Consumer<List<Integer>> body;
        private final List<List<Integer>> handled = new CopyOnWriteArrayList<>();
        private final Map<List<Integer>, Throwable> failures = new ConcurrentHashMap<>();
        private final Map<List<Integer>, Thread> handledOn = new ConcurrentHashMap<>();
        private final Map<List<Integer>, Thread> failedOn = new ConcurrentHashMap<>();

        Recorder(Consumer<List<Integer>> body) {
            this.body = body;
        }

        @Override
        public void handle(List<Integer> batch) {
            handled.add(batch);
            handledOn.put(batch, Thread.currentThread());
            body.accept(batch);
        }

        @Override
        public void onFailure(List<Integer> batch, Throwable cause) {
            failures.put(batch, cause);
            failedOn.put(batch, Thread.currentThread());
        }
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Nested
    @DisplayName("Limits")
    class Limits {

        @Test
        @DisplayName("Should never run more handlers at once than the pool size")
        void maxOverlap() {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            Recorder handler = new Recorder(batch -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                pause(20);
                running.decrementAndGet();
            });

            ExecutionReport report = executor(ExecutorConfig.builder().subBatchSize(2).concurrency(3))
                    .execute(items(30), handler, CallBudget.unlimited());

            assertTrue(peak.get() <= 3, "peak was " + peak.get());
            assertTrue(report.maxConcurrency() <= 3);
            assertEquals(15, report.dispatchedBatches());
            assertEquals(30, report.succeededItems());
            assertEquals(0, report.deferredItems());
        }

        @Test
        @DisplayName("Should dispatch no more sub-batches than the budget allows and defer the rest")
        void budget() {
            Recorder handler = new Recorder(batch -> { });
            CallBudget budget = new CallBudget(4);

            ExecutionReport report = executor(ExecutorConfig.builder().subBatchSize(3).concurrency(3))
                    .execute(items(30), handler, budget);

            assertEquals(4, report.dispatchedBatches());
            assertEquals(4, handler.handled.size());
            assertEquals(12, report.dispatchedItems());
            assertEquals(18, report.deferredItems());
            assertFalse(report.aborted());
            assertTrue(budget.isExhausted());
        }

        @Test
        @DisplayName("Should stagger starts within a group and cool down between groups")
        void staggerAndCooldown() {
            Recorder handler = new Recorder(batch -> { });

            executor(ExecutorConfig.builder().subBatchSize(1).concurrency(3)
                    .staggerDelay(Duration.ofMillis(100)).groupCooldown(Duration.ofSeconds(7)))
                    .execute(items(10), handler, CallBudget.unlimited());

            assertEquals(3, sleeper.count(Duration.ofSeconds(7)));
            assertEquals(4, sleeper.count(Duration.ZERO));
            assertEquals(3, sleeper.count(Duration.ofMillis(100)));
            assertEquals(3, sleeper.count(Duration.ofMillis(200)));
        }

        @Test
        @DisplayName("Should return an empty report for no items")
        void empty() {
            ExecutionReport report = executor(ExecutorConfig.builder())
                    .execute(List.of(), new Recorder(batch -> { }), CallBudget.unlimited());

            assertEquals(ExecutionReport.empty(), report);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should fail only the affected sub-batch on an ordinary error")
        void isolatedFailure() {
            Recorder handler = new Recorder(batch -> {
                if (batch.contains(0)) {
                    throw new OracleException("HTTP 500");
                }
            });

            ExecutionReport report = executor(ExecutorConfig.builder().subBatchSize(2).concurrency(2))
                    .execute(items(6), handler, CallBudget.unlimited());

            assertFalse(report.aborted());
            assertEquals(2, report.failedItems());
            assertEquals(4, report.succeededItems());
            assertEquals(1, handler.failures.size());
            assertInstanceOf(OracleException.class, handler.failures.get(List.of(0, 1)));
        }

        @Test
        @DisplayName("Should abort without the failure callback when the ledger fails")
        void ledgerFailureAborts() {
            Recorder handler = new Recorder(batch -> {
                throw new LedgerException("graph down");
            });

            ExecutionReport report = executor(ExecutorConfig.builder().subBatchSize(2).concurrency(1))
                    .execute(items(8), handler, CallBudget.unlimited());

            assertTrue(report.aborted());
            assertInstanceOf(LedgerException.class, report.abortCause());
            assertEquals(1, report.dispatchedBatches());
            assertEquals(6, report.deferredItems());
            assertTrue(handler.failures.isEmpty());
        }

        @Test
        @DisplayName("Should abort after exhausted retries and still report the failed sub-batch")
        void retriesExhaustedAborts() {
            Recorder handler = new Recorder(batch -> {
                throw new RetryExhaustedException(4, new RateLimitedException("429"));
            });

            ExecutionReport report = executor(ExecutorConfig.builder().subBatchSize(2).concurrency(1))
                    .execute(items(8), handler, CallBudget.unlimited());

            assertTrue(report.aborted());
            assertEquals("Gave up after 4 attempts: 429", report.abortMessage());
            assertEquals(1, handler.failures.size());
            assertEquals(6, report.deferredItems());
        }

        @Test
        @DisplayName("Should report an oracle timeout as an isolated sub-batch failure")
        void timeoutIsIsolated() {
            Recorder handler = new Recorder(batch -> {
                if (batch.contains(0)) {
                    throw new OracleTimeoutException(Duration.ofMillis(200));
                }
            });

            ExecutionReport report = executor(ExecutorConfig.builder().subBatchSize(1).concurrency(2))
                    .execute(items(2), handler, CallBudget.unlimited());

            assertFalse(report.aborted());
            assertEquals(1, report.failedItems());
            assertEquals(1, report.succeededItems());
            assertInstanceOf(OracleTimeoutException.class, handler.failures.get(List.of(0)));
        }

        @Test
        @DisplayName("Should run the failure callback on the worker that ran the sub-batch")
        void failureCallbackOnWorker() {
            Recorder handler = new Recorder(batch -> {
                throw new OracleException("HTTP 500");
            });

            executor(ExecutorConfig.builder().subBatchSize(1).concurrency(1))
                    .execute(items(1), handler, CallBudget.unlimited());

            assertSame(handler.handledOn.get(List.of(0)), handler.failedOn.get(List.of(0)));
            assertNotSame(Thread.currentThread(), handler.failedOn.get(List.of(0)));
        }

        @Test
        @DisplayName("Should let a slow sub-batch finish instead of cancelling it")
        void slowSubBatchFinishes() {
            AtomicInteger finished = new AtomicInteger();
            Recorder handler = new Recorder(batch -> {
                pause(300);
                finished.incrementAndGet();
            });

            ExecutionReport report = executor(ExecutorConfig.builder().subBatchSize(1).concurrency(1)
                    .callTimeout(Duration.ofMillis(50)))
                    .execute(items(2), handler, CallBudget.unlimited());

            assertEquals(2, finished.get());
            assertEquals(2, report.succeededItems());
            assertTrue(handler.failures.isEmpty());
        }

        @Test
        @DisplayName("Should abort when the failure callback cannot reach the ledger")
        void ledgerFailureInCallbackAborts() {
            SubBatchHandler<Integer> handler = new SubBatchHandler<>() {
                @Override
                public void handle(List<Integer> batch) {
                    throw new OracleException("HTTP 500");
                }

                @Override
                public void onFailure(List<Integer> batch, Throwable cause) {
                    throw new LedgerException("graph down");
                }
            };

            ExecutionReport report = executor(ExecutorConfig.builder().subBatchSize(2).concurrency(1))
                    .execute(items(6), handler, CallBudget.unlimited());

            assertTrue(report.aborted());
            assertInstanceOf(LedgerException.class, report.abortCause());
            assertEquals(4, report.deferredItems());
        }
    }

    @Test
    @DisplayName("Should reject invalid configuration")
    void configValidation() {
        List<Runnable> invalid = new ArrayList<>();
        invalid.add(() -> ExecutorConfig.builder().subBatchSize(0));
        invalid.add(() -> ExecutorConfig.builder().concurrency(0));
        invalid.add(() -> ExecutorConfig.builder().concurrency(ExecutorConfig.MAX_CONCURRENCY + 1));
        invalid.add(() -> ExecutorConfig.builder().callTimeout(Duration.ZERO));
        invalid.forEach(r -> assertThrows(IllegalArgumentException.class, r::run));
    }
}
