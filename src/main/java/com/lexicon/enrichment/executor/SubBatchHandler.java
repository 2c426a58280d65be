package com.lexicon.enrichment.executor;

import java.util.List;

/**
 * Work done for one sub-batch on an executor thread.
 *
 * @param <T> item type
 */
public interface SubBatchHandler<T> {

    /**
     * Processes the sub-batch. A thrown exception fails the whole sub-batch.
     */
    void handle(List<T> batch);

    /**
     * Called on the same worker thread right after {@link #handle} threw.
     * Not called when the failure aborts the run because the ledger itself is unavailable.
     */
    void onFailure(List<T> batch, Throwable cause);
}
