package com.lexicon.enrichment.ledger;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.WorkItem;
import com.lexicon.enrichment.core.model.WorkItemKind;
import com.lexicon.enrichment.core.model.WorkStatus;
import com.lexicon.enrichment.graph.CypherExecutor;
import com.lexicon.enrichment.graph.GraphRows;
import com.lexicon.enrichment.graph.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

/**
 * Ledger stored as {@code :WorkItem} nodes in FalkorDB.
 * Transition guards are part of each statement; a statement that matches nothing is an illegal transition.
 */
public class GraphJobLedger implements JobLedger {
    private static final Logger log = LoggerFactory.getLogger(GraphJobLedger.class);

    private final CypherExecutor executor;
    private final Clock clock;

    public GraphJobLedger(CypherExecutor executor) {
        this(executor, Clock.systemUTC());
    }

    public GraphJobLedger(CypherExecutor executor, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.clock = clock;
    }

    @Override
    public int resetStale() {
        long reset = store("resetStale", () -> executor.resetStaleWorkItems(now()));
        log.info("ledger.reset_stale count={}", reset);
        return (int) reset;
    }

    @Override
    public int resetAll() {
        long reset = store("resetAll", () -> executor.resetAllWorkItems(now()));
        log.info("ledger.reset_all count={}", reset);
        return (int) reset;
    }

    @Override
    public Page<WorkItem> findPending(PageRequest request, WorkOrdering ordering) {
        List<Map<String, Object>> rows = store("findPending", () ->
                executor.findPendingWorkItems(ordering.cypherOrderBy(), request.offset(), request.limit()));
        return new Page<>(rows.stream().map(this::mapToWorkItem).toList(), request);
    }

    @Override
    public void markProcessing(Collection<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        long updated = store("markProcessing", () -> executor.markWorkItemsProcessing(ids, now()));
        if (updated != ids.size()) {
            throw new IllegalStateException("Expected " + ids.size() + " pending work items but claimed " + updated);
        }
    }

    @Override
    public void markCompleted(String id) {
        long updated = store("markCompleted", () -> executor.markWorkItemCompleted(id, now()));
        if (updated == 0) {
            throw new IllegalStateException("Work item " + id + " is not processing");
        }
    }

    @Override
    public void markError(String id, String message) {
        String stored = message != null && message.length() > InputSanitizer.MAX_CYPHER_VALUE_LENGTH
                ? message.substring(0, InputSanitizer.MAX_CYPHER_VALUE_LENGTH)
                : message;
        long updated = store("markError", () -> executor.markWorkItemError(id, stored, now()));
        if (updated == 0) {
            throw new IllegalStateException("Work item " + id + " is not pending or processing");
        }
    }

    @Override
    public int enqueue(Collection<WorkItem> items) {
        if (items.isEmpty()) {
            return 0;
        }
        long before = countAll();
        List<Map<String, Object>> rows = new ArrayList<>(items.size());
        for (WorkItem item : items) {
            InputSanitizer.sanitizeForCypher(item.getSourceText());
            rows.add(CypherExecutor.params(
                    "id", item.getId(),
                    "sourceText", item.getSourceText(),
                    "targetHint", item.getTargetHint(),
                    "parentId", item.getParentId(),
                    "sequenceNumber", item.getSequenceNumber(),
                    "kind", item.getKind().name(),
                    "note", item.getNote(),
                    "updatedAt", now()
            ));
        }
        store("enqueue", () -> {
            executor.mergeWorkItems(rows);
            return null;
        });
        return (int) (countAll() - before);
    }

    @Override
    public Optional<WorkItem> get(String id) {
        List<Map<String, Object>> rows = store("get", () -> executor.findWorkItemById(id));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToWorkItem(rows.get(0)));
    }

    @Override
    public List<WorkItem> findByParent(String parentId, int fromSequence, int toSequence) {
        if (parentId == null) {
            return List.of();
        }
        return store("findByParent", () -> executor.findWorkItemsByParent(parentId, fromSequence, toSequence))
                .stream()
                .map(this::mapToWorkItem)
                .toList();
    }

    @Override
    public Map<WorkStatus, Long> countByStatus() {
        Map<WorkStatus, Long> counts = new EnumMap<>(WorkStatus.class);
        for (WorkStatus status : WorkStatus.values()) {
            counts.put(status, 0L);
        }
        for (Map<String, Object> row : store("countByStatus", executor::countWorkItemsByStatus)) {
            counts.merge(WorkStatus.fromStorageValue(GraphRows.string(row, "status")),
                    GraphRows.longValue(row, "total", 0), Long::sum);
        }
        return counts;
    }

    private long countAll() {
        return countByStatus().values().stream().mapToLong(Long::longValue).sum();
    }

    private long now() {
        return clock.millis();
    }

    /**
     * Runs a store call, translating driver failures into {@link LedgerException}.
     */
    private <T> T store(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LedgerException("Ledger operation '" + operation + "' failed: " + e.getMessage(), e);
        }
    }

    private WorkItem mapToWorkItem(Map<String, Object> row) {
        String kind = GraphRows.string(row, "kind");
        return WorkItem.builder()
                .id(GraphRows.string(row, "id"))
                .sourceText(Objects.requireNonNullElse(GraphRows.string(row, "sourceText"), ""))
                .targetHint(GraphRows.string(row, "targetHint"))
                .parentId(GraphRows.string(row, "parentId"))
                .sequenceNumber(GraphRows.integer(row, "sequenceNumber", 0))
                .kind(kind != null ? WorkItemKind.valueOf(kind) : WorkItemKind.CORPUS_SENTENCE)
                .note(GraphRows.string(row, "note"))
                .status(WorkStatus.fromStorageValue(GraphRows.string(row, "status")))
                .errorMessage(GraphRows.string(row, "errorMessage"))
                .updatedAt(Instant.ofEpochMilli(GraphRows.longValue(row, "updatedAt", clock.millis())))
                .build();
    }
}
