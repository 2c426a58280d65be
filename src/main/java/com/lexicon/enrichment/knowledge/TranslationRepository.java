package com.lexicon.enrichment.knowledge;

import com.lexicon.enrichment.api.Page;
import com.lexicon.enrichment.api.PageRequest;
import com.lexicon.enrichment.core.model.TranslationRecord;

import java.util.List;

/**
 * Translation rows, grouped by the work item that produced them.
 */
public interface TranslationRepository {

    /**
     * Replaces every row of the work item. Re-running an item therefore never duplicates rows.
     */
    void replaceForWorkItem(String workItemId, List<TranslationRecord> records);

    List<TranslationRecord> findByWorkItem(String workItemId);

    Page<TranslationRecord> findAll(PageRequest request);

    long count();
}
