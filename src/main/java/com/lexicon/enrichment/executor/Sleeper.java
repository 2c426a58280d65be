package com.lexicon.enrichment.executor;

import java.time.Duration;

/**
 * Pause source for retries, staggering and cooldowns. Tests substitute a recording sleeper.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
