package com.lexicon.enrichment.context;

import java.util.List;
import java.util.Optional;

/**
 * Context of one oracle batch, one entry per work item in batch order.
 */
public record EnrichmentContext(List<ItemContext> items) {

    public EnrichmentContext {
        items = List.copyOf(items);
    }

    public Optional<ItemContext> find(String workItemId) {
        return items.stream().filter(c -> c.item().getId().equals(workItemId)).findFirst();
    }

    public int size() {
        return items.size();
    }
}
