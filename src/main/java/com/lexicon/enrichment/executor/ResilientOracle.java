package com.lexicon.enrichment.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.lexicon.enrichment.metrics.MetricsService;
import com.lexicon.enrichment.oracle.InvalidOracleResponseException;
import com.lexicon.enrichment.oracle.OracleException;
import com.lexicon.enrichment.oracle.OracleProvider;
import com.lexicon.enrichment.oracle.RateLimitedException;
import com.lexicon.enrichment.tracing.Span;
import com.lexicon.enrichment.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Oracle calls wrapped in the retry policy, with timing metrics and a span per call.
 *
 * <p>With a call timeout, every attempt runs on a separate call thread and the caller waits at most the
 * timeout, counted from the start of that attempt. An attempt that runs over is cancelled and surfaces as
 * {@link OracleTimeoutException}, which is not retried.</p>
 */
public class ResilientOracle implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResilientOracle.class);

    private final OracleProvider provider;
    private final RetryPolicy retryPolicy;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Duration callTimeout;
    private final ExecutorService callPool;

    public ResilientOracle(OracleProvider provider, RetryPolicy retryPolicy, MetricsService metrics,
                           TracingService tracing) {
        this(provider, retryPolicy, metrics, tracing, null);
    }

    /**
     * @param callTimeout longest wait for one attempt, or null to wait as long as the provider takes
     */
    public ResilientOracle(OracleProvider provider, RetryPolicy retryPolicy, MetricsService metrics,
                           TracingService tracing, Duration callTimeout) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.tracing = Objects.requireNonNull(tracing, "tracing is required");
        if (callTimeout != null && (callTimeout.isZero() || callTimeout.isNegative())) {
            throw new IllegalArgumentException("callTimeout must be > 0");
        }
        this.callTimeout = callTimeout;
        this.callPool = callTimeout != null ? Executors.newCachedThreadPool(new CallThreadFactory()) : null;
    }

    public JsonNode complete(String prompt) {
        return complete(prompt, RetryPolicy.RetryListener.NONE);
    }

    /**
     * @param listener notified before each backoff, in addition to the built-in logging and metrics
     * @throws RetryExhaustedException if every attempt was rate limited
     */
    public JsonNode complete(String prompt, RetryPolicy.RetryListener listener) {
        try (Span span = tracing.startSpan(TracingService.ORACLE_CALL_SPAN,
                Map.of("provider", provider.getProviderName()))) {
            try {
                JsonNode answer = retryPolicy.execute(() -> timedCall(prompt), (attempt, delay, failure) -> {
                    metrics.incrementOracleRetry();
                    log.warn("oracle.rate_limited attempt={} retryInMs={}", attempt, delay.toMillis());
                    listener.beforeRetry(attempt, delay, failure);
                });
                span.setStatus(Span.SpanStatus.OK);
                return answer;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    private JsonNode timedCall(String prompt) {
        long start = System.nanoTime();
        String outcome = "error";
        try {
            JsonNode answer = invoke(prompt);
            outcome = "success";
            return answer;
        } catch (OracleTimeoutException e) {
            outcome = "timeout";
            throw e;
        } catch (RateLimitedException e) {
            outcome = "rate_limited";
            throw e;
        } catch (InvalidOracleResponseException e) {
            outcome = "invalid_response";
            throw e;
        } finally {
            metrics.recordOracleCall(provider.getProviderName(), outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private JsonNode invoke(String prompt) {
        if (callPool == null) {
            return provider.complete(prompt);
        }
        Future<JsonNode> call = callPool.submit(() -> provider.complete(prompt));
        try {
            return call.get(callTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("oracle.timeout provider={} timeoutMs={}", provider.getProviderName(), callTimeout.toMillis());
            throw new OracleTimeoutException(callTimeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new OracleException("Oracle call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new OracleException("Interrupted while waiting for the oracle", e);
        }
    }

    public OracleProvider getProvider() {
        return provider;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    @Override
    public void close() {
        if (callPool != null) {
            callPool.shutdownNow();
        }
    }

    private static final class CallThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "oracle-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
