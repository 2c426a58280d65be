package com.lexicon.enrichment.executor;

import com.lexicon.enrichment.core.Batches;
import com.lexicon.enrichment.ledger.LedgerException;
import com.lexicon.enrichment.metrics.MetricsService;
import com.lexicon.enrichment.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatches sub-batches to a fixed pool of {@code concurrency} threads.
 *
 * <p>Sub-batches go out in groups of at most {@code concurrency}. Within a group the i-th member starts
 * after {@code i * staggerDelay}; the whole group is awaited, then a cooldown passes before the next group.
 * Each dispatched sub-batch spends one unit of the {@link CallBudget}. Once the budget is spent the remaining
 * items are reported as deferred. A {@link RetryExhaustedException} or {@link LedgerException} stops
 * dispatching for the rest of the pass.</p>
 *
 * <p>A failed sub-batch is handed to {@link SubBatchHandler#onFailure} on the worker that ran it, so the
 * items of one sub-batch are only ever touched by one thread. Sub-batches are never cancelled mid-way; the
 * per-call timeout belongs to the oracle call inside the handler.</p>
 */
public class RateLimitedBatchExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedBatchExecutor.class);

    private final ExecutorConfig config;
    private final Sleeper sleeper;
    private final MetricsService metrics;
    private final ExecutorService pool;

    public RateLimitedBatchExecutor(ExecutorConfig config) {
        this(config, Sleeper.SYSTEM, new NoOpMetricsService());
    }

    public RateLimitedBatchExecutor(ExecutorConfig config, Sleeper sleeper, MetricsService metrics) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.pool = Executors.newFixedThreadPool(config.getConcurrency(), new WorkerThreadFactory());
    }

    public ExecutorConfig getConfig() {
        return config;
    }

    public <T> ExecutionReport execute(List<T> items, SubBatchHandler<T> handler, CallBudget budget) {
        return execute(items, config.getSubBatchSize(), handler, budget);
    }

    public <T> ExecutionReport execute(List<T> items, int subBatchSize, SubBatchHandler<T> handler,
                                       CallBudget budget) {
        if (items.isEmpty()) {
            return ExecutionReport.empty();
        }
        List<List<T>> subBatches = Batches.partition(items, subBatchSize);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();

        int next = 0;
        int dispatchedBatches = 0;
        int dispatchedItems = 0;
        int succeeded = 0;
        int failed = 0;
        Throwable abortCause = null;
        boolean budgetExhausted = false;

        log.info("executor.start items={} subBatches={} concurrency={} budgetRemaining={}",
                items.size(), subBatches.size(), config.getConcurrency(), budget.getRemaining());

        while (next < subBatches.size() && abortCause == null && !budgetExhausted) {
            if (next > 0) {
                try {
                    sleeper.sleep(config.getGroupCooldown());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    abortCause = e;
                    break;
                }
            }

            List<Dispatched<T>> group = new ArrayList<>(config.getConcurrency());
            for (int slot = 0; slot < config.getConcurrency() && next < subBatches.size(); slot++) {
                if (!budget.tryAcquire()) {
                    budgetExhausted = true;
                    log.info("executor.budget_exhausted limit={}", budget.getLimit());
                    break;
                }
                List<T> batch = subBatches.get(next++);
                Duration stagger = config.getStaggerDelay().multipliedBy(slot);
                Future<?> future = pool.submit(() -> runStaggered(batch, stagger, handler, active, maxActive));
                group.add(new Dispatched<>(batch, future));
                dispatchedBatches++;
                dispatchedItems += batch.size();
                metrics.recordBatchSize(batch.size());
            }

            for (Dispatched<T> dispatched : group) {
                Throwable failure = await(dispatched);
                if (failure == null) {
                    succeeded += dispatched.batch().size();
                    continue;
                }
                failed += dispatched.batch().size();
                if (failure instanceof InterruptedException) {
                    abortCause = abortCause == null ? failure : abortCause;
                    continue;
                }
                if (failure instanceof LedgerException) {
                    log.error("executor.ledger_failure batchSize={} error={}", dispatched.batch().size(),
                            failure.getMessage(), failure);
                    abortCause = abortCause == null ? failure : abortCause;
                    continue;
                }
                if (failure instanceof RetryExhaustedException) {
                    log.error("executor.retries_exhausted attempts={} error={}",
                            ((RetryExhaustedException) failure).getAttempts(), failure.getMessage());
                    abortCause = abortCause == null ? failure : abortCause;
                } else {
                    log.warn("executor.sub_batch_failed batchSize={} error={}", dispatched.batch().size(),
                            failure.getMessage());
                }
            }
        }

        int deferred = 0;
        for (int i = next; i < subBatches.size(); i++) {
            deferred += subBatches.get(i).size();
        }
        ExecutionReport report = new ExecutionReport(dispatchedBatches, dispatchedItems, succeeded, failed,
                deferred, abortCause != null, abortCause, maxActive.get());
        log.info("executor.done dispatched={} succeeded={} failed={} deferred={} aborted={} maxConcurrency={}",
                dispatchedBatches, succeeded, failed, deferred, report.aborted(), report.maxConcurrency());
        return report;
    }

    private <T> void runStaggered(List<T> batch, Duration stagger, SubBatchHandler<T> handler,
                                  AtomicInteger active, AtomicInteger maxActive) {
        try {
            sleeper.sleep(stagger);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted before start");
        }
        int running = active.incrementAndGet();
        maxActive.accumulateAndGet(running, Math::max);
        try {
            handler.handle(batch);
        } catch (LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            notifyFailure(handler, batch, e);
            throw e;
        } finally {
            active.decrementAndGet();
        }
    }

    /**
     * Runs the failure callback on the worker. A ledger failure inside it replaces the original failure so the
     * pass aborts; any other callback failure is logged and the original failure stands.
     */
    private <T> void notifyFailure(SubBatchHandler<T> handler, List<T> batch, RuntimeException failure) {
        try {
            handler.onFailure(batch, failure);
        } catch (LedgerException e) {
            e.addSuppressed(failure);
            throw e;
        } catch (RuntimeException e) {
            log.error("executor.failure_handler_failed error={}", e.getMessage(), e);
        }
    }

    /**
     * Waits for one sub-batch to finish.
     *
     * @return null on success, otherwise the failure
     */
    private <T> Throwable await(Dispatched<T> dispatched) {
        try {
            dispatched.future().get();
            return null;
        } catch (ExecutionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (CancellationException e) {
            return e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        }
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Dispatched<T>(List<T> batch, Future<?> future) {
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "enrichment-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
