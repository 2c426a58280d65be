package com.lexicon.enrichment.executor;

import java.time.Duration;

/**
 * Limits of the batch executor.
 */
public final class ExecutorConfig {

    public static final int MAX_CONCURRENCY = 64;

    private final int subBatchSize;
    private final int concurrency;
    private final Duration staggerDelay;
    private final Duration groupCooldown;
    private final int callBudget;
    private final Duration callTimeout;

    private ExecutorConfig(Builder builder) {
        this.subBatchSize = builder.subBatchSize;
        this.concurrency = builder.concurrency;
        this.staggerDelay = builder.staggerDelay;
        this.groupCooldown = builder.groupCooldown;
        this.callBudget = builder.callBudget;
        this.callTimeout = builder.callTimeout;
    }

    public static ExecutorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getSubBatchSize() {
        return subBatchSize;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public Duration getStaggerDelay() {
        return staggerDelay;
    }

    public Duration getGroupCooldown() {
        return groupCooldown;
    }

    /**
     * Oracle calls one run may dispatch.
     */
    public int getCallBudget() {
        return callBudget;
    }

    /**
     * Longest wait for one oracle attempt, enforced by {@link ResilientOracle} from the start of the attempt.
     */
    public Duration getCallTimeout() {
        return callTimeout;
    }

    @Override
    public String toString() {
        return "ExecutorConfig{subBatchSize=" + subBatchSize + ", concurrency=" + concurrency
                + ", staggerDelay=" + staggerDelay + ", groupCooldown=" + groupCooldown
                + ", callBudget=" + callBudget + ", callTimeout=" + callTimeout + "}";
    }

    public static class Builder {
        private int subBatchSize = 3;
        private int concurrency = 10;
        private Duration staggerDelay = Duration.ofMillis(100);
        private Duration groupCooldown = Duration.ofSeconds(1);
        private int callBudget = 1000;
        private Duration callTimeout = Duration.ofSeconds(120);

        public Builder subBatchSize(int subBatchSize) {
            if (subBatchSize < 1) {
                throw new IllegalArgumentException("subBatchSize must be >= 1");
            }
            this.subBatchSize = subBatchSize;
            return this;
        }

        public Builder concurrency(int concurrency) {
            if (concurrency < 1 || concurrency > MAX_CONCURRENCY) {
                throw new IllegalArgumentException("concurrency must be between 1 and " + MAX_CONCURRENCY);
            }
            this.concurrency = concurrency;
            return this;
        }

        public Builder staggerDelay(Duration staggerDelay) {
            this.staggerDelay = requireNonNegative(staggerDelay, "staggerDelay");
            return this;
        }

        public Builder groupCooldown(Duration groupCooldown) {
            this.groupCooldown = requireNonNegative(groupCooldown, "groupCooldown");
            return this;
        }

        public Builder callBudget(int callBudget) {
            if (callBudget < 0) {
                throw new IllegalArgumentException("callBudget must be >= 0");
            }
            this.callBudget = callBudget;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()) {
                throw new IllegalArgumentException("callTimeout must be > 0");
            }
            this.callTimeout = callTimeout;
            return this;
        }

        private static Duration requireNonNegative(Duration value, String name) {
            if (value == null || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
            return value;
        }

        public ExecutorConfig build() {
            return new ExecutorConfig(this);
        }
    }
}
