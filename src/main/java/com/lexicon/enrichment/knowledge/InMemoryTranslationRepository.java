package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.TranslationRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory translation store, ordered by work item id.
 */
public class InMemoryTranslationRepository implements TranslationRepository {

    private final Map<String, List<TranslationRecord>> byWorkItem = new ConcurrentSkipListMap<>();

    @Override
    public void replaceForWorkItem(String workItemId, List<TranslationRecord> records) {
        for (TranslationRecord record : records) {
            if (!workItemId.equals(record.workItemId())) {
                throw new IllegalArgumentException("Record of " + record.workItemId() + " passed for " + workItemId);
            }
        }
        byWorkItem.put(workItemId, records.stream()
                .sorted(Comparator.comparing(TranslationRecord::variant))
                .toList());
    }

    @Override
    public List<TranslationRecord> findByWorkItem(String workItemId) {
        return byWorkItem.getOrDefault(workItemId, List.of());
    }

    @Override
    public Page<TranslationRecord> findAll(PageRequest request) {
        List<TranslationRecord> all = byWorkItem.values().stream().flatMap(List::stream).toList();
        return Page.slice(all, request);
    }

    @Override
    public long count() {
        return byWorkItem.values().stream().mapToLong(List::size).sum();
    }
}
