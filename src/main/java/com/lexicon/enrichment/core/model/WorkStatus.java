package com.lexicon.enrichment.core.model;

import java.util.Locale;

/**
 * Processing status of a {@link WorkItem} in the job ledger.
 * Items are never deleted; a failed item keeps its error message until the next reset.
 */
public enum WorkStatus {
    /**
     * Waiting to be selected by a run.
     */
    PENDING,

    /**
     * Claimed by a run. Items left here by an interrupted run are recovered by a stale reset.
     */
    PROCESSING,

    /**
     * Enriched and persisted.
     */
    COMPLETED,

    /**
     * Failed; the ledger keeps the error message.
     */
    ERROR;

    /**
     * Value stored in the graph.
     */
    public String storageValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkStatus fromStorageValue(String value) {
        if (value == null) {
            return PENDING;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
