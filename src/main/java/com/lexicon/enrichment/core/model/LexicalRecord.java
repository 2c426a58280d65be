package com.lexicon.enrichment.core.model;

import java.util.Objects;

/**
 * Raw idiom or translation-aid record, input of the deduplication engine.
 *
 * @param id          record id
 * @param term        the source-language phrase
 * @param gloss       canonical-language meaning, may be null
 * @param explanation explanation text, may be null
 * @param featureType feature type from the source, may be null
 * @param sourceTable the table the record was read from
 */
public record LexicalRecord(
        String id,
        String term,
        String gloss,
        String explanation,
        String featureType,
        String sourceTable
) {
    public LexicalRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(term, "term is required");
    }

    public String normalizedKey() {
        return LexicalKeys.of(term);
    }

    public String explanationOrEmpty() {
        return explanation != null ? explanation : "";
    }
}
