package com.lexicon.enrichment.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC scope for pipeline logging. Entries are removed again on {@link #close()}.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId, "enrichment")) {
 *     log.info("run.started limit={}", limit);
 * }
 * </pre>
 *
 * MDC is per thread: executor workers open their own scope with {@link #forBatch(String, String)}.
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String PIPELINE = "pipeline";
    public static final String BATCH_ID = "batchId";
    public static final String WORK_ITEM_ID = "workItemId";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId, String pipeline) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(PIPELINE, pipeline);
        return ctx;
    }

    public static LogContext forBatch(String runId, String batchId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(BATCH_ID, batchId);
        return ctx;
    }

    public static LogContext forWorkItem(String workItemId) {
        LogContext ctx = new LogContext();
        ctx.put(WORK_ITEM_ID, workItemId);
        return ctx;
    }

    public static String newRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
