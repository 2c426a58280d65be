package com.lexicon.enrichment.context;

import com.lexicon.enrichment.core.model.TermSense;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Batched dictionary access for context assembly.
 */
public interface DictionaryLookup {

    /**
     * Senses of every source-language term whose normalized text is one of {@code words}, in one query.
     *
     * @param words lower-cased words
     * @return senses keyed by word; words without an entry are absent
     */
    Map<String, List<TermSense>> lookupSenses(Collection<String> words);
}
