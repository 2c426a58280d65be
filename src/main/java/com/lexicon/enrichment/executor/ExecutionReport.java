package com.lexicon.enrichment.executor;

/**
 * Outcome of one executor pass.
 *
 * @param dispatchedBatches sub-batches handed to the pool, equal to the budget units spent
 * @param dispatchedItems   items in dispatched sub-batches
 * @param succeededItems    items in sub-batches whose handler returned normally
 * @param failedItems       items in sub-batches that failed, timed out or were cut off by an abort
 * @param deferredItems     items never dispatched because the budget ran out or the run aborted
 * @param aborted           whether the run stopped dispatching because of a run-level failure
 * @param abortCause        the run-level failure, null unless aborted
 * @param maxConcurrency    highest number of handlers observed running at once
 */
public record ExecutionReport(
        int dispatchedBatches,
        int dispatchedItems,
        int succeededItems,
        int failedItems,
        int deferredItems,
        boolean aborted,
        Throwable abortCause,
        int maxConcurrency
) {
    public static ExecutionReport empty() {
        return new ExecutionReport(0, 0, 0, 0, 0, false, null, 0);
    }

    public String abortMessage() {
        return abortCause != null ? abortCause.getMessage() : null;
    }
}
