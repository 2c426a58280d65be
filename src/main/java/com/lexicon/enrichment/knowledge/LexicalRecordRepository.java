package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.LexicalRecord;

import java.util.Collection;

/**
 * Raw idiom and translation-aid records awaiting cleanup.
 */
public interface LexicalRecordRepository {

    /**
     * Inserts or replaces records by id.
     */
    void saveAll(Collection<LexicalRecord> records);

    /**
     * Records in id order.
     */
    Page<LexicalRecord> findAll(PageRequest request);

    long count();
}
