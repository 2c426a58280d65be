package com.lexicon.enrichment.pipeline;

import com.lexicon.enrichment.executor.CallBudget;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of one run, passed explicitly to everything the run touches.
 */
public class RunContext {

    private final String runId;
    private final CallBudget budget;
    private final RunLog log;
    private final PromptTraceHook promptTraceHook;

    private final AtomicInteger selected = new AtomicInteger();
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private volatile String details = "Starting";

    public RunContext(String runId, CallBudget budget, RunLog log, PromptTraceHook promptTraceHook) {
        this.runId = Objects.requireNonNull(runId, "runId is required");
        this.budget = Objects.requireNonNull(budget, "budget is required");
        this.log = Objects.requireNonNull(log, "log is required");
        this.promptTraceHook = Objects.requireNonNull(promptTraceHook, "promptTraceHook is required");
    }

    public String getRunId() {
        return runId;
    }

    public CallBudget getBudget() {
        return budget;
    }

    public RunLog getLog() {
        return log;
    }

    public void tracePrompt(String prompt) {
        promptTraceHook.onPrompt(runId, prompt);
    }

    public PromptTraceHook getPromptTraceHook() {
        return promptTraceHook;
    }

    public void setSelected(int count) {
        selected.set(count);
    }

    public int getSelected() {
        return selected.get();
    }

    public void recordCompleted(int count) {
        completed.addAndGet(count);
    }

    public void recordFailed(int count) {
        failed.addAndGet(count);
    }

    public int getCompleted() {
        return completed.get();
    }

    public int getFailed() {
        return failed.get();
    }

    public int getProcessed() {
        return completed.get() + failed.get();
    }

    public int percentComplete() {
        int total = selected.get();
        if (total == 0) {
            return 0;
        }
        return (int) Math.min(100, Math.round(getProcessed() * 100.0 / total));
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }
}
