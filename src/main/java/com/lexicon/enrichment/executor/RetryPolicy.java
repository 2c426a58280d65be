package com.lexicon.enrichment.executor;

import com.lexicon.enrichment.oracle.RateLimitedException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Exponential backoff with jitter for a single call.
 *
 * <p>Only failures accepted by the retryable predicate are retried; anything else propagates at once.
 * The n-th retry waits {@code baseDelay * multiplier^(n-1)} plus a random jitter of up to {@code maxJitter}.</p>
 */
public final class RetryPolicy {

    /**
     * Notified before each backoff sleep.
     */
    @FunctionalInterface
    public interface RetryListener {
        RetryListener NONE = (attempt, delay, failure) -> { };

        void beforeRetry(int failedAttempt, Duration delay, RuntimeException failure);
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxJitter;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.multiplier = builder.multiplier;
        this.maxJitter = builder.maxJitter;
        this.retryable = builder.retryable;
        this.sleeper = builder.sleeper;
        this.random = builder.random;
    }

    /**
     * Four attempts, 5 s base delay doubling each time, up to 1 s of jitter, retrying rate-limit signals only.
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public <T> T execute(Supplier<T> call) {
        return execute(call, RetryListener.NONE);
    }

    /**
     * Runs the call, retrying retryable failures.
     *
     * @throws RetryExhaustedException if the last allowed attempt failed with a retryable failure
     */
    public <T> T execute(Supplier<T> call, RetryListener listener) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (!retryable.test(e)) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    throw new RetryExhaustedException(attempt, e);
                }
                Duration delay = delayBeforeRetry(attempt);
                listener.beforeRetry(attempt, delay, e);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    /**
     * Backoff after the given failed attempt (1-based), jitter included.
     */
    public Duration delayBeforeRetry(int failedAttempt) {
        double factor = Math.pow(multiplier, failedAttempt - 1);
        long backoffMillis = Math.round(baseDelay.toMillis() * factor);
        long jitterMillis = Math.round(maxJitter.toMillis() * random.getAsDouble());
        return Duration.ofMillis(backoffMillis + jitterMillis);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getMaxJitter() {
        return maxJitter;
    }

    public boolean isRetryable(Throwable failure) {
        return retryable.test(failure);
    }

    public static class Builder {
        private int maxAttempts = 4;
        private Duration baseDelay = Duration.ofSeconds(5);
        private double multiplier = 2.0;
        private Duration maxJitter = Duration.ofSeconds(1);
        private Predicate<Throwable> retryable = RateLimitedException.class::isInstance;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay == null || baseDelay.isNegative()) {
                throw new IllegalArgumentException("baseDelay must be >= 0");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be >= 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxJitter(Duration maxJitter) {
            if (maxJitter == null || maxJitter.isNegative()) {
                throw new IllegalArgumentException("maxJitter must be >= 0");
            }
            this.maxJitter = maxJitter;
            return this;
        }

        public Builder retryOn(Predicate<Throwable> retryable) {
            this.retryable = Objects.requireNonNull(retryable, "retryable is required");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
            return this;
        }

        /**
         * Source of jitter in [0, 1).
         */
        public Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random is required");
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
