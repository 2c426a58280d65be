package com.lexicon.enrichment.executor;

/**
 * A retryable failure persisted through every attempt. Aborts the run.
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("Gave up after " + attempts + " attempts: " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
