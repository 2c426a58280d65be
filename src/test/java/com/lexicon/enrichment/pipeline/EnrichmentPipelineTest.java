package com.lexicon.enrichment.pipeline;

import com.lexicon.enrichment.context.ContextAssembler;
import com.lexicon.enrichment.context.ContextOptions;
import com.lexicon.enrichment.core.model.Concept;
import com.lexicon.enrichment.core.model.TranslationRecord;
import com.lexicon.enrichment.core.model.WorkItem;
import com.lexicon.enrichment.core.model.WorkStatus;
import com.lexicon.enrichment.executor.*;
import com.lexicon.enrichment.knowledge.InMemoryConceptRepository;
import com.lexicon.enrichment.knowledge.InMemoryHighlightRepository;
import com.lexicon.enrichment.knowledge.InMemoryTranslationRepository;
import com.lexicon.enrichment.ledger.InMemoryJobLedger;
import com.lexicon.enrichment.metrics.NoOpMetricsService;
import com.lexicon.enrichment.oracle.OracleProvider;
import com.lexicon.enrichment.oracle.RateLimitedException;
import com.lexicon.enrichment.persist.ResultPersister;
import com.lexicon.enrichment.resolution.ResolutionCascade;
import com.lexicon.enrichment.tracing.NoOpTracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EnrichmentPipeline Tests")
class EnrichmentPipelineTest {

    private static final String ANSWER = """
            {'results':[
              {'original_id':'w1','expansions':[{'cleaned_text':'Dåt Hus es grot.',
                'best_translation':'Das Haus ist groß.','confidence_score':0.92,
                'alternative_translations':[{'translation':'Das Haus ist gross.','confidence_score':0.6}],
                'discovered_highlights':[{'phrase':'grot Hus','gloss':'großes Haus','type':'idiom','relevance_score':7}],
                'cross_references':[{'target_term':'Hof','relation_type':'see_also'}]}]},
              {'original_id':'w2','expansions':[{'cleaned_text':'Hi kumt.','best_translation':'Er kommt.',
                'confidence_score':0.8}]}]}
            """;

    private InMemoryJobLedger ledger;
    private InMemoryTranslationRepository translations;
    private InMemoryHighlightRepository highlights;
    private InMemoryConceptRepository concepts;
    private RateLimitedBatchExecutor executor;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryJobLedger();
        translations = new InMemoryTranslationRepository();
        highlights = new InMemoryHighlightRepository();
        concepts = new InMemoryConceptRepository();
        concepts.upsert(Concept.builder().id("c-haus").label("Haus").build());
        concepts.upsert(Concept.builder().id("c-hof").label("Hof").build());
        ledger.enqueue(List.of(
                WorkItem.builder().id("w1").sourceText("Dåt Hus es grot.").parentId("c-haus").sequenceNumber(1).build(),
                WorkItem.builder().id("w2").sourceText("Hi kumt.").parentId("c-haus").sequenceNumber(2).build()));
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.close();
        }
    }

    private EnrichmentPipeline pipeline(OracleProvider provider, int subBatchSize) {
        return pipeline(provider, subBatchSize, null);
    }

    private EnrichmentPipeline pipeline(OracleProvider provider, int subBatchSize, Duration callTimeout) {
        executor = new RateLimitedBatchExecutor(ExecutorConfig.builder()
                .subBatchSize(subBatchSize)
                .concurrency(2)
                .staggerDelay(Duration.ZERO)
                .groupCooldown(Duration.ZERO)
                .build(), duration -> { }, new NoOpMetricsService());
        RetryPolicy retry = RetryPolicy.builder().sleeper(duration -> { }).random(() -> 0.0).build();
        return EnrichmentPipeline.builder()
                .ledger(ledger)
                .contextAssembler(new ContextAssembler(concepts, highlights, ledger, ContextOptions.defaults()))
                .oracle(new ResilientOracle(provider, retry, new NoOpMetricsService(), new NoOpTracingService(),
                        callTimeout))
                .persister(new ResultPersister(translations, highlights, concepts,
                        ResolutionCascade.standard(concepts), ledger, new NoOpMetricsService()))
                .executor(executor)
                .build();
    }

    private static RunContext context(int budget) {
        return new RunContext("run-1", new CallBudget(budget), new RunLog(), PromptTraceHook.NONE);
    }

    private WorkItem stored(String id) {
        return ledger.get(id).orElseThrow();
    }

    @Nested
    @DisplayName("Successful runs")
    class Successful {

        @Test
        @DisplayName("Should persist translations, highlights and relations and complete both items")
        void completes() {
            RunSummary summary = pipeline(ScriptedOracleProvider.answering(ANSWER), 3).run(10, context(10));

            assertEquals(2, summary.selected());
            assertEquals(2, summary.completed());
            assertEquals(0, summary.failed());
            assertFalse(summary.aborted());
            assertEquals(WorkStatus.COMPLETED, stored("w1").getStatus());
            assertEquals(WorkStatus.COMPLETED, stored("w2").getStatus());
            assertEquals(3, translations.count());
            assertEquals(7, highlights.findByKey("grot hus").orElseThrow().relevance());
            assertEquals("c-hof", concepts.findRelationsFrom("c-haus").get(0).getTargetConceptId());
        }

        @Test
        @DisplayName("Should include the neighbouring sentence in the prompt")
        void promptContext() {
            ScriptedOracleProvider oracle = ScriptedOracleProvider.answering(ANSWER);

            pipeline(oracle, 3).run(10, context(10));

            assertEquals(1, oracle.prompts().size());
            assertTrue(oracle.prompts().get(0).contains("neighbouring_sentences"));
        }

        @Test
        @DisplayName("Should reset stale items before selecting")
        void resetsStale() {
            ledger.markProcessing(List.of("w1"));
            RunContext context = context(10);

            pipeline(ScriptedOracleProvider.answering(ANSWER), 3).run(10, context);

            assertEquals(WorkStatus.COMPLETED, stored("w1").getStatus());
            assertTrue(context.getLog().recentLines(10).stream().anyMatch(l -> l.contains("Reset 1 stale")));
        }

        @Test
        @DisplayName("Should report nothing to do without pending items")
        void nothingToDo() {
            ledger.markProcessing(List.of("w1", "w2"));
            ledger.markCompleted("w1");
            ledger.markCompleted("w2");
            RunContext context = context(10);

            RunSummary summary = pipeline(ScriptedOracleProvider.answering(ANSWER), 3).run(10, context);

            assertEquals(0, summary.selected());
            assertEquals("Nothing to do", context.getDetails());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should leave items in ERROR with a message and write nothing for an empty answer")
        void emptyAnswer() {
            RunSummary summary = pipeline(ScriptedOracleProvider.answering("{}"), 3).run(10, context(10));

            assertEquals(0, summary.completed());
            assertEquals(2, summary.failed());
            assertFalse(summary.aborted());
            for (String id : List.of("w1", "w2")) {
                WorkItem item = stored(id);
                assertEquals(WorkStatus.ERROR, item.getStatus());
                assertEquals("Oracle answer has no results array", item.getErrorMessage());
            }
            assertEquals(0, translations.count());
            assertEquals(0, highlights.count());
            assertTrue(concepts.findRelationsFrom("c-haus").isEmpty());
        }

        @Test
        @DisplayName("Should fail only the item without a result")
        void partialAnswer() {
            String answer = """
                    {'results':[{'original_id':'w2','expansions':[{'cleaned_text':'Hi kumt.',
                      'best_translation':'Er kommt.','confidence_score':0.8}]}]}
                    """;

            RunSummary summary = pipeline(ScriptedOracleProvider.answering(answer), 3).run(10, context(10));

            assertEquals(1, summary.completed());
            assertEquals(1, summary.failed());
            assertEquals(WorkStatus.ERROR, stored("w1").getStatus());
            assertEquals("No result returned for this item", stored("w1").getErrorMessage());
            assertTrue(translations.findByWorkItem("w1").isEmpty());
        }

        @Test
        @DisplayName("Should leave items pending once the call budget is spent")
        void budget() {
            RunSummary summary = pipeline(ScriptedOracleProvider.answering(ANSWER), 1).run(10, context(1));

            assertEquals(1, summary.completed());
            assertEquals(1, summary.deferred());
            assertEquals(WorkStatus.COMPLETED, stored("w1").getStatus());
            assertEquals(WorkStatus.PENDING, stored("w2").getStatus());
        }

        @Test
        @DisplayName("Should retry a rate-limited call and log the wait")
        void rateLimited() {
            AtomicInteger calls = new AtomicInteger();
            ScriptedOracleProvider oracle = new ScriptedOracleProvider(prompt -> {
                if (calls.incrementAndGet() == 1) {
                    throw new RateLimitedException("429");
                }
                return ANSWER;
            });
            RunContext context = context(10);

            RunSummary summary = pipeline(oracle, 3).run(10, context);

            assertEquals(2, summary.completed());
            assertTrue(context.getLog().recentLines(20).stream()
                    .anyMatch(l -> l.contains("Rate limit hit. Retrying in 5s (attempt 1)")));
        }

        @Test
        @DisplayName("Should abort the run after exhausted retries")
        void retriesExhausted() {
            ScriptedOracleProvider oracle = new ScriptedOracleProvider(prompt -> {
                throw new RateLimitedException("429");
            });

            RunSummary summary = pipeline(oracle, 1).run(10, context(10));

            assertTrue(summary.aborted());
            assertTrue(summary.abortReason().startsWith("Gave up after 4 attempts"));
            assertEquals(WorkStatus.ERROR, stored("w1").getStatus());
        }

        @Test
        @DisplayName("Should end an aborted run with a single terminal log line")
        void abortedRunLogsOnce() {
            ScriptedOracleProvider oracle = new ScriptedOracleProvider(prompt -> {
                throw new RateLimitedException("429");
            });
            RunContext context = context(10);

            pipeline(oracle, 1).run(10, context);

            List<String> lines = context.getLog().recentLines(50);
            assertEquals(1, lines.stream().filter(l -> l.contains("Run aborted")).count());
            assertTrue(lines.stream().noneMatch(l -> l.contains("Run finished")));
        }
    }

    @Nested
    @DisplayName("Call timeout")
    class CallTimeout {

        @Test
        @DisplayName("Should fail only the sub-batch whose oracle call runs over")
        void slowOracleFailsItsItems() {
            ScriptedOracleProvider oracle = new ScriptedOracleProvider(prompt -> {
                if (prompt.contains("\"original_id\" : \"w1\"")) {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return ANSWER;
            });

            RunSummary summary = pipeline(oracle, 1, Duration.ofMillis(200)).run(10, context(10));

            assertFalse(summary.aborted());
            assertEquals(WorkStatus.ERROR, stored("w1").getStatus());
            assertTrue(stored("w1").getErrorMessage().contains("did not answer within 200 ms"));
            assertEquals(WorkStatus.COMPLETED, stored("w2").getStatus());
            assertTrue(translations.findByWorkItem("w1").isEmpty());
        }

        @Test
        @DisplayName("Should complete items whose persistence outlasts the call timeout")
        void slowPersistenceCompletes() {
            translations = new InMemoryTranslationRepository() {
                @Override
                public void replaceForWorkItem(String workItemId, List<TranslationRecord> records) {
                    try {
                        Thread.sleep(300);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                    super.replaceForWorkItem(workItemId, records);
                }
            };

            RunSummary summary = pipeline(ScriptedOracleProvider.answering(ANSWER), 3, Duration.ofMillis(100))
                    .run(10, context(10));

            assertEquals(2, summary.completed());
            assertEquals(0, summary.failed());
            assertEquals(WorkStatus.COMPLETED, stored("w1").getStatus());
            assertEquals(WorkStatus.COMPLETED, stored("w2").getStatus());
            assertEquals(3, translations.count());
        }
    }
}
