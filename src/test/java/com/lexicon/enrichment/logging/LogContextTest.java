package com.lexicon.enrichment.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set runId and pipeline in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-1", "enrichment")) {
            assertEquals("run-1", MDC.get(LogContext.RUN_ID));
            assertEquals("enrichment", MDC.get(LogContext.PIPELINE));
        }
    }

    @Test
    @DisplayName("forBatch should set runId and batchId in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("run-1", "batch-7")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("batch-7", MDC.get("batchId"));
        }
    }

    @Test
    @DisplayName("with should add extra entries that are removed on close")
    void withAddsEntries() {
        LogContext ctx = LogContext.forWorkItem("w-1").with("kind", "corpus_sentence");
        assertEquals("w-1", MDC.get("workItemId"));
        assertEquals("corpus_sentence", MDC.get("kind"));

        ctx.close();

        assertNull(MDC.get("workItemId"));
        assertNull(MDC.get("kind"));
    }

    @Test
    @DisplayName("Closing an inner scope should keep entries it did not add")
    void nestedScopes() {
        try (LogContext run = LogContext.forRun("run-1", "highlight-cleaning")) {
            try (LogContext item = LogContext.forWorkItem("w-1")) {
                assertEquals("run-1", MDC.get("runId"));
            }
            assertNull(MDC.get("workItemId"));
            assertEquals("highlight-cleaning", MDC.get("pipeline"));
        }
        assertNull(MDC.get("pipeline"));
    }

    @Test
    @DisplayName("newRunId should generate unique ids")
    void uniqueRunIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.newRunId());
        }
        assertEquals(100, ids.size());
    }
}
