package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.Highlight;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory highlight store. Each upsert is an atomic compute on the key.
 */
public class InMemoryHighlightRepository implements HighlightRepository {

    private final ConcurrentHashMap<String, Highlight> highlights = new ConcurrentHashMap<>();

    @Override
    public UpsertResult upsert(Highlight highlight) {
        UpsertResult[] result = new UpsertResult[1];
        highlights.compute(highlight.normalizedKey(), (key, stored) -> {
            if (stored == null) {
                result[0] = UpsertResult.inserted();
                return highlight;
            }
            if (HighlightRepository.supersedes(stored.relevance(), highlight.relevance())) {
                result[0] = new UpsertResult(UpsertOutcome.REPLACED, stored.relevance(), stored.gloss());
                return highlight;
            }
            result[0] = new UpsertResult(UpsertOutcome.KEPT_EXISTING, stored.relevance(), stored.gloss());
            return stored;
        });
        return result[0];
    }

    @Override
    public Optional<Highlight> findByKey(String normalizedKey) {
        return Optional.ofNullable(highlights.get(normalizedKey));
    }

    @Override
    public List<Highlight> findByMinRelevance(int minRelevance) {
        return highlights.values().stream()
                .filter(h -> h.relevance() >= minRelevance)
                .sorted(Comparator.comparingInt(Highlight::relevance).reversed()
                        .thenComparing(Highlight::normalizedKey))
                .toList();
    }

    @Override
    public Set<String> findAllKeys() {
        return Set.copyOf(highlights.keySet());
    }

    @Override
    public Page<Highlight> findAll(PageRequest request) {
        List<Highlight> sorted = highlights.values().stream()
                .sorted(Comparator.comparing(Highlight::normalizedKey))
                .toList();
        return Page.slice(sorted, request);
    }

    @Override
    public long count() {
        return highlights.size();
    }
}
