package com.lexicon.enrichment.context;

import com.lexicon.enrichment.core.model.Concept;
import com.lexicon.enrichment.core.model.Highlight;
import com.lexicon.enrichment.core.model.TermSense;
import com.lexicon.enrichment.core.model.WorkItem;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only context attached to one work item of a batch.
 *
 * @param item          the work item
 * @param senses        dictionary senses of the words of the item, keyed by word
 * @param highlights    known highlights whose key phrase occurs in the item text
 * @param parentConcept the headword the item belongs to, null if unknown
 * @param neighbours    other items of the same parent around this one, in sequence order
 */
public record ItemContext(
        WorkItem item,
        Map<String, List<TermSense>> senses,
        List<Highlight> highlights,
        Concept parentConcept,
        List<WorkItem> neighbours
) {
    public ItemContext {
        Objects.requireNonNull(item, "item is required");
        senses = senses != null ? Map.copyOf(senses) : Map.of();
        highlights = highlights != null ? List.copyOf(highlights) : List.of();
        neighbours = neighbours != null ? List.copyOf(neighbours) : List.of();
    }

    public Optional<Concept> parent() {
        return Optional.ofNullable(parentConcept);
    }
}
