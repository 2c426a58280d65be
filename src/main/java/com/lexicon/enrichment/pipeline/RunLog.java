package com.lexicon.enrichment.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, user-visible log of one run. Every line is also written to SLF4J.
 */
public class RunLog {
    private static final Logger log = LoggerFactory.getLogger(RunLog.class);

    public static final int DEFAULT_CAPACITY = 1000;
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

    public enum Level { INFO, SUCCESS, WARNING, ERROR }

    public record Entry(Instant timestamp, Level level, String message) {
        public String format() {
            return "[" + TIME.format(timestamp) + "] [" + level + "] " + message;
        }
    }

    private final int capacity;
    private final Clock clock;
    private final Deque<Entry> entries = new ArrayDeque<>();

    public RunLog() {
        this(DEFAULT_CAPACITY, Clock.systemUTC());
    }

    public RunLog(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public void info(String message) {
        add(Level.INFO, message);
    }

    public void success(String message) {
        add(Level.SUCCESS, message);
    }

    public void warning(String message) {
        add(Level.WARNING, message);
    }

    public void error(String message) {
        add(Level.ERROR, message);
    }

    public void add(Level level, String message) {
        switch (level) {
            case ERROR -> log.error("run.log {}", message);
            case WARNING -> log.warn("run.log {}", message);
            default -> log.info("run.log {}", message);
        }
        synchronized (entries) {
            entries.addLast(new Entry(clock.instant(), level, message));
            while (entries.size() > capacity) {
                entries.removeFirst();
            }
        }
    }

    /**
     * The most recent entries, oldest first.
     */
    public List<Entry> recent(int count) {
        synchronized (entries) {
            List<Entry> all = new ArrayList<>(entries);
            return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
        }
    }

    public List<String> recentLines(int count) {
        return recent(count).stream().map(Entry::format).toList();
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
