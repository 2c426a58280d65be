package com.lexicon.enrichment.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An idiom or notable phrase annotated with a canonical-language gloss and a relevance score.
 * Stored once per normalized key term; see {@link #normalizedKey()}.
 *
 * @param keyTerm     the phrase as it appears in source text
 * @param gloss       canonical-language meaning, may be null
 * @param explanation explanation in the canonical language, may be null
 * @param category    category tag such as "idiom" or "proverb", may be null
 * @param relevance   relevance score, 0 to 10
 * @param tags        free tags
 * @param sourceTable name of the table or collection the evidence came from
 * @param sourceIds   ids of the work items or raw records the highlight was derived from
 */
public record Highlight(
        String keyTerm,
        String gloss,
        String explanation,
        String category,
        int relevance,
        List<String> tags,
        String sourceTable,
        List<String> sourceIds
) {
    public static final int MIN_RELEVANCE = 0;
    public static final int MAX_RELEVANCE = 10;

    public Highlight {
        Objects.requireNonNull(keyTerm, "keyTerm is required");
        keyTerm = keyTerm.trim();
        if (keyTerm.isEmpty()) {
            throw new IllegalArgumentException("keyTerm must not be blank");
        }
        if (relevance < MIN_RELEVANCE || relevance > MAX_RELEVANCE) {
            throw new IllegalArgumentException("relevance must be between 0 and 10, was " + relevance);
        }
        tags = tags != null ? List.copyOf(tags) : List.of();
        sourceIds = sourceIds != null ? List.copyOf(sourceIds) : List.of();
    }

    /**
     * Storage key. Homonyms share a key, so two senses of one spelling compete for the same row.
     */
    public String normalizedKey() {
        return LexicalKeys.of(keyTerm);
    }
}
