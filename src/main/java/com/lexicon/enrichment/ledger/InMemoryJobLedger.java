package com.lexicon.enrichment.ledger;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.WorkItem;
import com.lexicon.enrichment.core.model.WorkStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory ledger for tests and single-process use.
 * Transitions are synchronized so that check-then-set is atomic.
 */
public class InMemoryJobLedger implements JobLedger {
    private static final Logger log = LoggerFactory.getLogger(InMemoryJobLedger.class);

    private final Map<String, WorkItem> items = new ConcurrentHashMap<>();

    @Override
    public synchronized int resetStale() {
        int reset = 0;
        for (WorkItem item : items.values()) {
            if (item.getStatus() == WorkStatus.PROCESSING || item.getStatus() == WorkStatus.ERROR) {
                items.put(item.getId(), item.withStatus(WorkStatus.PENDING, null));
                reset++;
            }
        }
        log.debug("ledger.reset_stale count={}", reset);
        return reset;
    }

    @Override
    public synchronized int resetAll() {
        int reset = 0;
        for (WorkItem item : items.values()) {
            if (item.getStatus() != WorkStatus.PENDING) {
                items.put(item.getId(), item.withStatus(WorkStatus.PENDING, null));
                reset++;
            }
        }
        return reset;
    }

    @Override
    public Page<WorkItem> findPending(PageRequest request, WorkOrdering ordering) {
        List<WorkItem> pending = items.values().stream()
                .filter(i -> i.getStatus() == WorkStatus.PENDING)
                .sorted(ordering.comparator())
                .toList();
        return Page.slice(pending, request);
    }

    @Override
    public synchronized void markProcessing(Collection<String> ids) {
        for (String id : ids) {
            requireStatus(id, EnumSet.of(WorkStatus.PENDING), WorkStatus.PROCESSING);
        }
        for (String id : ids) {
            items.computeIfPresent(id, (k, item) -> item.withStatus(WorkStatus.PROCESSING, null));
        }
    }

    @Override
    public synchronized void markCompleted(String id) {
        requireStatus(id, EnumSet.of(WorkStatus.PROCESSING), WorkStatus.COMPLETED);
        items.computeIfPresent(id, (k, item) -> item.withStatus(WorkStatus.COMPLETED, null));
    }

    @Override
    public synchronized void markError(String id, String message) {
        requireStatus(id, EnumSet.of(WorkStatus.PENDING, WorkStatus.PROCESSING), WorkStatus.ERROR);
        items.computeIfPresent(id, (k, item) -> item.withStatus(WorkStatus.ERROR, message));
    }

    @Override
    public synchronized int enqueue(Collection<WorkItem> newItems) {
        int added = 0;
        for (WorkItem item : newItems) {
            if (items.putIfAbsent(item.getId(), item.withStatus(WorkStatus.PENDING, null)) == null) {
                added++;
            }
        }
        return added;
    }

    @Override
    public Optional<WorkItem> get(String id) {
        return Optional.ofNullable(items.get(id));
    }

    @Override
    public List<WorkItem> findByParent(String parentId, int fromSequence, int toSequence) {
        return items.values().stream()
                .filter(i -> Objects.equals(parentId, i.getParentId()))
                .filter(i -> i.getSequenceNumber() >= fromSequence && i.getSequenceNumber() <= toSequence)
                .sorted(Comparator.comparingInt(WorkItem::getSequenceNumber).thenComparing(WorkItem::getId))
                .toList();
    }

    @Override
    public Map<WorkStatus, Long> countByStatus() {
        Map<WorkStatus, Long> counts = new EnumMap<>(WorkStatus.class);
        for (WorkStatus status : WorkStatus.values()) {
            counts.put(status, 0L);
        }
        items.values().forEach(i -> counts.merge(i.getStatus(), 1L, Long::sum));
        return counts;
    }

    public int size() {
        return items.size();
    }

    private void requireStatus(String id, Set<WorkStatus> allowed, WorkStatus target) {
        WorkItem item = items.get(id);
        if (item == null) {
            throw new IllegalStateException("Unknown work item: " + id);
        }
        if (!allowed.contains(item.getStatus())) {
            throw new IllegalStateException("Illegal transition for work item " + id + ": "
                    + item.getStatus() + " -> " + target);
        }
    }
}
