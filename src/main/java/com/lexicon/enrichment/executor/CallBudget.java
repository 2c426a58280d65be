package com.lexicon.enrichment.executor;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Upper bound on the oracle calls one run may dispatch. One unit per dispatched sub-batch; retries are free.
 */
public final class CallBudget {

    private final int limit;
    private final AtomicInteger used = new AtomicInteger();

    public CallBudget(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        this.limit = limit;
    }

    public static CallBudget unlimited() {
        return new CallBudget(Integer.MAX_VALUE);
    }

    /**
     * Takes one unit if any is left.
     */
    public boolean tryAcquire() {
        while (true) {
            int current = used.get();
            if (current >= limit) {
                return false;
            }
            if (used.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public int getLimit() {
        return limit;
    }

    public int getUsed() {
        return used.get();
    }

    public int getRemaining() {
        return limit - used.get();
    }

    public boolean isExhausted() {
        return used.get() >= limit;
    }
}
