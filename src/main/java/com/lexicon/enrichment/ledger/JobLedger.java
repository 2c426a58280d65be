package com.lexicon.enrichment.ledger;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.WorkItem;
import com.lexicon.enrichment.core.model.WorkStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable processing state of every work item; the single source of truth for remaining work.
 *
 * <p>Legal transitions:</p>
 * <pre>
 * PENDING    -> PROCESSING        markProcessing
 * PROCESSING -> COMPLETED         markCompleted
 * PENDING | PROCESSING -> ERROR   markError
 * PROCESSING | ERROR   -> PENDING resetStale
 * </pre>
 * Any other transition raises {@link IllegalStateException}. Store failures raise {@link LedgerException}.
 */
public interface JobLedger {

    /**
     * Page size used by {@link #selectPending(int, WorkOrdering)}.
     */
    int PAGE_SIZE = 1000;

    /**
     * Moves every PROCESSING or ERROR item back to PENDING. Idempotent.
     *
     * @return number of items reset
     */
    int resetStale();

    /**
     * Moves every item, including completed ones, back to PENDING.
     *
     * @return number of items reset
     */
    int resetAll();

    /**
     * Reads one range of pending items in the given order.
     */
    Page<WorkItem> findPending(PageRequest request, WorkOrdering ordering);

    /**
     * Returns up to {@code limit} pending items in a stable order.
     * Reads in pages of {@value #PAGE_SIZE} until a short page or the limit, so no row is lost to a store-side cap.
     */
    default List<WorkItem> selectPending(int limit, WorkOrdering ordering) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        List<WorkItem> selected = new ArrayList<>(Math.min(limit, PAGE_SIZE));
        PageRequest request = PageRequest.first(PAGE_SIZE);
        while (selected.size() < limit) {
            Page<WorkItem> page = findPending(request, ordering);
            selected.addAll(page.content());
            if (!page.hasNext()) {
                break;
            }
            request = request.next();
        }
        return selected.size() > limit ? List.copyOf(selected.subList(0, limit)) : selected;
    }

    /**
     * Claims pending items for the current run.
     *
     * @throws IllegalStateException if any of the items is not pending
     */
    void markProcessing(Collection<String> ids);

    /**
     * @throws IllegalStateException if the item is not processing
     */
    void markCompleted(String id);

    /**
     * Records a failure. The item stays in the ledger with its message.
     *
     * @throws IllegalStateException if the item is already completed or failed
     */
    void markError(String id, String message);

    /**
     * Adds new items as PENDING. Items whose id already exists keep their current state.
     *
     * @return number of items actually added
     */
    int enqueue(Collection<WorkItem> items);

    Optional<WorkItem> get(String id);

    /**
     * Items of one parent whose sequence number lies in {@code [fromSequence, toSequence]}, in sequence order.
     */
    List<WorkItem> findByParent(String parentId, int fromSequence, int toSequence);

    Map<WorkStatus, Long> countByStatus();
}
