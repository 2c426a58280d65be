package com.lexicon.enrichment.tracing;

/**
 * A traced stretch of a run: the whole run, one oracle call or one persistence step.
 * Opened by {@link TracingService#startSpan} and ended by {@link #close()}, so callers hold it in a
 * try-with-resources block.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records {@code cause} and marks the span as failed.
     */
    default void fail(Throwable cause) {
        recordException(cause);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
