package com.lexicon.enrichment.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Validated output for one work item, ready to persist.
 *
 * @param workItemId      the source work item
 * @param translations    the best translation first, then alternatives
 * @param highlights      discovered highlights
 * @param crossReferences discovered cross-references
 */
public record EnrichedResult(
        String workItemId,
        List<TranslationRecord> translations,
        List<Highlight> highlights,
        List<CrossReference> crossReferences
) {
    public EnrichedResult {
        Objects.requireNonNull(workItemId, "workItemId is required");
        translations = translations != null ? List.copyOf(translations) : List.of();
        highlights = highlights != null ? List.copyOf(highlights) : List.of();
        crossReferences = crossReferences != null ? List.copyOf(crossReferences) : List.of();
    }
}
