package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.LexicalRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory raw record store, ordered by id.
 */
public class InMemoryLexicalRecordRepository implements LexicalRecordRepository {

    private final Map<String, LexicalRecord> records = new ConcurrentSkipListMap<>();

    @Override
    public void saveAll(Collection<LexicalRecord> newRecords) {
        newRecords.forEach(r -> records.put(r.id(), r));
    }

    @Override
    public Page<LexicalRecord> findAll(PageRequest request) {
        return Page.slice(List.copyOf(records.values()), request);
    }

    @Override
    public long count() {
        return records.size();
    }
}
