package com.lexicon.enrichment.ledger;

import com.lexicon.enrichment.core.model.WorkItem;

import java.util.Comparator;

/**
 * Stable orderings for pending-work selection.
 * Each ordering carries both the in-memory comparator and the equivalent Cypher clause.
 */
public enum WorkOrdering {

    /**
     * Groups items of the same parent together, in sequence order. Keeps context windows warm.
     */
    PARENT_THEN_SEQUENCE(
            Comparator.comparing(WorkItem::getParentId, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparingInt(WorkItem::getSequenceNumber)
                    .thenComparing(WorkItem::getId),
            "w.parentId, w.sequenceNumber, w.id"),

    IDENTIFIER(Comparator.comparing(WorkItem::getId), "w.id");

    private final Comparator<WorkItem> comparator;
    private final String cypherOrderBy;

    WorkOrdering(Comparator<WorkItem> comparator, String cypherOrderBy) {
        this.comparator = comparator;
        this.cypherOrderBy = cypherOrderBy;
    }

    public Comparator<WorkItem> comparator() {
        return comparator;
    }

    public String cypherOrderBy() {
        return cypherOrderBy;
    }
}
