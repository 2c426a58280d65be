package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.Highlight;
import com.lexicon.enrichment.knowledge.HighlightRepository.UpsertOutcome;
import com.lexicon.enrichment.knowledge.HighlightRepository.UpsertResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryHighlightRepository Tests")
class InMemoryHighlightRepositoryTest {

    private final InMemoryHighlightRepository repository = new InMemoryHighlightRepository();

    private static Highlight highlight(String key, String gloss, int relevance) {
        return new Highlight(key, gloss, null, "idiom", relevance, List.of(), "idioms", List.of("w1"));
    }

    @Test
    @DisplayName("Should keep relevance 5 when 3 arrives later")
    void neverDowngrade() {
        repository.upsert(highlight("rum gung", "herumgehen", 5));

        UpsertResult result = repository.upsert(highlight("Rum Gung", "spazieren", 3));

        assertEquals(UpsertOutcome.KEPT_EXISTING, result.outcome());
        Highlight stored = repository.findByKey("rum gung").orElseThrow();
        assertEquals(5, stored.relevance());
        assertEquals("herumgehen", stored.gloss());
    }

    @Test
    @DisplayName("Should replace relevance 5 with 8")
    void upgrade() {
        repository.upsert(highlight("rum gung", "herumgehen", 5));

        UpsertResult result = repository.upsert(highlight("rum gung", "spazieren gehen", 8));

        assertEquals(UpsertOutcome.REPLACED, result.outcome());
        assertEquals(5, result.previousRelevance());
        assertEquals("herumgehen", result.previousGloss());
        assertEquals(8, repository.findByKey("rum gung").orElseThrow().relevance());
    }

    @Test
    @DisplayName("Should keep the stored highlight on equal relevance")
    void equalRelevanceKeeps() {
        repository.upsert(highlight("rum gung", "first", 5));

        assertEquals(UpsertOutcome.KEPT_EXISTING, repository.upsert(highlight("rum gung", "second", 5)).outcome());
        assertEquals("first", repository.findByKey("rum gung").orElseThrow().gloss());
    }

    @Test
    @DisplayName("Should end with the highest relevance under concurrent upserts")
    void concurrentUpserts() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        for (int relevance = 0; relevance <= 10; relevance++) {
            int r = relevance;
            pool.submit(() -> {
                start.await();
                return repository.upsert(highlight("rum gung", "gloss " + r, r));
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(10, repository.findByKey("rum gung").orElseThrow().relevance());
    }

    @Test
    @DisplayName("Should filter by minimum relevance and page by key")
    void queries() {
        repository.upsert(highlight("b", "g", 7));
        repository.upsert(highlight("a", "g", 9));
        repository.upsert(highlight("c", "g", 2));

        assertEquals(List.of("a", "b"), repository.findByMinRelevance(6).stream().map(Highlight::keyTerm).toList());
        assertEquals(List.of("a", "b"), repository.findAll(PageRequest.first(2)).content().stream()
                .map(Highlight::keyTerm).toList());
        assertEquals(3, repository.findAllKeys().size());
        assertEquals(3, repository.count());
    }

    @Test
    @DisplayName("Should collect source ids across every stored highlight")
    void sourceIds() {
        repository.upsert(new Highlight("hog", "Schwein", null, "idiom", 6, List.of(), "idioms", List.of("1", "2")));
        repository.upsert(new Highlight("hoggwash", "Unsinn", null, "idiom", 3, List.of(), "idioms", List.of("3")));

        assertEquals(Set.of("1", "2", "3"), repository.findAllSourceIds());
    }

    @Test
    @DisplayName("Should reject out-of-range relevance")
    void relevanceRange() {
        assertThrows(IllegalArgumentException.class, () -> highlight("a", "g", 11));
        assertThrows(IllegalArgumentException.class, () -> highlight("a", "g", -1));
    }
}
