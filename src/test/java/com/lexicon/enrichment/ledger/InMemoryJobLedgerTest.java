package com.lexicon.enrichment.ledger;

import com.lexicon.enrichment.core.model.WorkItem;
import com.lexicon.enrichment.core.model.WorkStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryJobLedger Tests")
class InMemoryJobLedgerTest {

    private InMemoryJobLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryJobLedger();
    }

    private static WorkItem item(String id, String parentId, int sequence) {
        return WorkItem.builder()
                .id(id)
                .sourceText("Sentence " + id)
                .parentId(parentId)
                .sequenceNumber(sequence)
                .build();
    }

    @Nested
    @DisplayName("Stale reset")
    class StaleReset {

        @Test
        @DisplayName("Should move processing and error items back to pending")
        void resetsProcessingAndError() {
            ledger.enqueue(List.of(item("a", "p", 1), item("b", "p", 2), item("c", "p", 3)));
            ledger.markProcessing(List.of("a", "b"));
            ledger.markError("b", "boom");
            ledger.markProcessing(List.of("c"));
            ledger.markCompleted("c");

            assertEquals(2, ledger.resetStale());

            assertEquals(WorkStatus.PENDING, ledger.get("a").orElseThrow().getStatus());
            WorkItem b = ledger.get("b").orElseThrow();
            assertEquals(WorkStatus.PENDING, b.getStatus());
            assertNull(b.getErrorMessage());
            assertEquals(WorkStatus.COMPLETED, ledger.get("c").orElseThrow().getStatus());
        }

        @Test
        @DisplayName("Should be idempotent")
        void idempotent() {
            ledger.enqueue(List.of(item("a", "p", 1), item("b", "p", 2)));
            ledger.markProcessing(List.of("a"));

            ledger.resetStale();
            Map<WorkStatus, Long> afterFirst = ledger.countByStatus();
            int secondReset = ledger.resetStale();

            assertEquals(0, secondReset);
            assertEquals(afterFirst, ledger.countByStatus());
            assertEquals(2L, afterFirst.get(WorkStatus.PENDING));
        }

        @Test
        @DisplayName("Should reset completed items only on a full reset")
        void resetAllIncludesCompleted() {
            ledger.enqueue(List.of(item("a", "p", 1)));
            ledger.markProcessing(List.of("a"));
            ledger.markCompleted("a");

            assertEquals(0, ledger.resetStale());
            assertEquals(1, ledger.resetAll());
            assertEquals(WorkStatus.PENDING, ledger.get("a").orElseThrow().getStatus());
        }
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("Should reject completing a pending item")
        void completeRequiresProcessing() {
            ledger.enqueue(List.of(item("a", "p", 1)));
            assertThrows(IllegalStateException.class, () -> ledger.markCompleted("a"));
        }

        @Test
        @DisplayName("Should reject claiming an item twice and leave the batch untouched")
        void claimIsAllOrNothing() {
            ledger.enqueue(List.of(item("a", "p", 1), item("b", "p", 2)));
            ledger.markProcessing(List.of("a"));

            assertThrows(IllegalStateException.class, () -> ledger.markProcessing(List.of("b", "a")));
            assertEquals(WorkStatus.PENDING, ledger.get("b").orElseThrow().getStatus());
        }

        @Test
        @DisplayName("Should keep the error message of a failed item")
        void errorKeepsMessage() {
            ledger.enqueue(List.of(item("a", "p", 1)));
            ledger.markError("a", "No result returned for this item");

            WorkItem failed = ledger.get("a").orElseThrow();
            assertEquals(WorkStatus.ERROR, failed.getStatus());
            assertEquals("No result returned for this item", failed.getErrorMessage());
            assertThrows(IllegalStateException.class, () -> ledger.markError("a", "again"));
        }

        @Test
        @DisplayName("Should reject unknown ids")
        void unknownId() {
            assertThrows(IllegalStateException.class, () -> ledger.markCompleted("missing"));
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Should select pending items grouped by parent in sequence order")
        void parentThenSequence() {
            ledger.enqueue(List.of(item("x3", "p2", 3), item("x1", "p1", 2), item("x2", "p1", 1), item("x4", "p2", 1)));

            List<WorkItem> selected = ledger.selectPending(10, WorkOrdering.PARENT_THEN_SEQUENCE);

            assertEquals(List.of("x2", "x1", "x4", "x3"), selected.stream().map(WorkItem::getId).toList());
        }

        @Test
        @DisplayName("Should page past the store page size without losing items")
        void pagesPastPageSize() {
            List<WorkItem> items = new ArrayList<>();
            for (int i = 0; i < JobLedger.PAGE_SIZE + 250; i++) {
                items.add(item(String.format("w%05d", i), "p", i));
            }
            ledger.enqueue(items);

            assertEquals(JobLedger.PAGE_SIZE + 250, ledger.selectPending(5000, WorkOrdering.IDENTIFIER).size());
            assertEquals(1200, ledger.selectPending(1200, WorkOrdering.IDENTIFIER).size());
        }

        @Test
        @DisplayName("Should skip items that are not pending")
        void onlyPending() {
            ledger.enqueue(List.of(item("a", "p", 1), item("b", "p", 2)));
            ledger.markProcessing(List.of("a"));

            assertEquals(List.of("b"), ledger.selectPending(10, WorkOrdering.IDENTIFIER).stream()
                    .map(WorkItem::getId).toList());
        }

        @Test
        @DisplayName("Should reject a non-positive limit")
        void rejectsZeroLimit() {
            assertThrows(IllegalArgumentException.class, () -> ledger.selectPending(0, WorkOrdering.IDENTIFIER));
        }
    }

    @Test
    @DisplayName("Should not re-enqueue an existing item")
    void enqueueKeepsExistingState() {
        ledger.enqueue(List.of(item("a", "p", 1)));
        ledger.markProcessing(List.of("a"));
        ledger.markCompleted("a");

        assertEquals(0, ledger.enqueue(List.of(item("a", "p", 1))));
        assertEquals(WorkStatus.COMPLETED, ledger.get("a").orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Should find neighbours of a parent within a sequence window")
    void findByParentWindow() {
        ledger.enqueue(List.of(item("a", "p", 1), item("b", "p", 2), item("c", "p", 3), item("d", "q", 2)));

        assertEquals(List.of("b", "c"), ledger.findByParent("p", 2, 5).stream().map(WorkItem::getId).toList());
    }
}
