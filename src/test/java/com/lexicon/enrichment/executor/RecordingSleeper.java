package com.lexicon.enrichment.executor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested pauses without sleeping.
 */
class RecordingSleeper implements Sleeper {

    private final List<Duration> pauses = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration duration) {
        pauses.add(duration);
    }

    List<Duration> pauses() {
        return pauses;
    }

    long count(Duration duration) {
        return pauses.stream().filter(duration::equals).count();
    }
}
