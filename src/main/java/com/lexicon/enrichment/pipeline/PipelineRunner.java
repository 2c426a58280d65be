package com.lexicon.enrichment.pipeline;

import com.lexicon.enrichment.executor.CallBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Starts runs of one pipeline in the background and reports their progress. At most one run is active.
 */
public class PipelineRunner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    static final int PROGRESS_LOG_LINES = 50;

    private final Pipeline pipeline;
    private final int callBudget;
    private final Supplier<PromptTraceHook> hookFactory;
    private final ExecutorService background;
    private final AtomicBoolean active = new AtomicBoolean();

    private volatile RunContext current;
    private volatile RunStatus status = RunStatus.IDLE;
    private volatile String lastError;
    private volatile RunSummary lastSummary;

    public PipelineRunner(Pipeline pipeline, int callBudget) {
        this(pipeline, callBudget, PromptTraceHook::sampleFirst);
    }

    public PipelineRunner(Pipeline pipeline, int callBudget, Supplier<PromptTraceHook> hookFactory) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline is required");
        if (callBudget < 0) {
            throw new IllegalArgumentException("callBudget must be >= 0");
        }
        this.callBudget = callBudget;
        this.hookFactory = Objects.requireNonNull(hookFactory, "hookFactory is required");
        this.background = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "pipeline-" + pipeline.getName());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts a run in the background.
     *
     * @throws RunAlreadyActiveException if a run of this pipeline is in progress
     */
    public RunHandle start(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        if (!active.compareAndSet(false, true)) {
            throw new RunAlreadyActiveException(pipeline.getName());
        }
        RunContext context = new RunContext(UUID.randomUUID().toString(), new CallBudget(callBudget),
                new RunLog(), hookFactory.get());
        current = context;
        status = RunStatus.RUNNING;
        lastError = null;
        context.getLog().info("Starting " + pipeline.getName() + " run for up to " + limit + " items");
        log.info("run.started pipeline={} runId={} limit={}", pipeline.getName(), context.getRunId(), limit);
        try {
            Future<RunSummary> future = background.submit(() -> execute(limit, context));
            return new RunHandle(context, future);
        } catch (RuntimeException e) {
            active.set(false);
            status = RunStatus.FAILED;
            lastError = e.getMessage();
            throw e;
        }
    }

    private RunSummary execute(int limit, RunContext context) {
        try {
            RunSummary summary = pipeline.run(limit, context);
            lastSummary = summary;
            if (summary.aborted()) {
                status = RunStatus.FAILED;
                lastError = summary.abortReason();
            } else {
                status = RunStatus.COMPLETED;
            }
            log.info("run.finished pipeline={} runId={} completed={} failed={} deferred={} aborted={}",
                    pipeline.getName(), context.getRunId(), summary.completed(), summary.failed(),
                    summary.deferred(), summary.aborted());
            return summary;
        } catch (RuntimeException e) {
            status = RunStatus.FAILED;
            lastError = e.getMessage();
            context.setDetails("Failed");
            context.getLog().error("Run failed: " + e.getMessage());
            log.error("run.failed pipeline={} runId={} error={}", pipeline.getName(), context.getRunId(),
                    e.getMessage(), e);
            throw e;
        } finally {
            active.set(false);
        }
    }

    public boolean isActive() {
        return active.get();
    }

    public RunProgress progress() {
        RunContext context = current;
        if (context == null) {
            return RunProgress.idle();
        }
        int percent = status == RunStatus.COMPLETED ? 100 : context.percentComplete();
        return new RunProgress(context.getRunId(), status, percent, context.getDetails(), lastError,
                context.getLog().recentLines(PROGRESS_LOG_LINES));
    }

    public Optional<RunSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary);
    }

    public String getPipelineName() {
        return pipeline.getName();
    }

    @Override
    public void close() {
        background.shutdown();
        try {
            if (!background.awaitTermination(5, TimeUnit.SECONDS)) {
                background.shutdownNow();
            }
        } catch (InterruptedException e) {
            background.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * A started run.
     */
    public record RunHandle(RunContext context, Future<RunSummary> future) {
        public String runId() {
            return context.getRunId();
        }
    }
}
