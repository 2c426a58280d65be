package com.lexicon.enrichment.persist;

import com.lexicon.enrichment.core.model.EnrichedResult;

import java.util.Map;
import java.util.Optional;

/**
 * Validation outcome of one oracle answer, split per work item.
 *
 * @param results  valid results keyed by work item id
 * @param failures error messages keyed by work item id; nothing may be written for these items
 */
public record ValidatedBatch(Map<String, EnrichedResult> results, Map<String, String> failures) {

    public ValidatedBatch {
        results = Map.copyOf(results);
        failures = Map.copyOf(failures);
    }

    public Optional<EnrichedResult> result(String workItemId) {
        return Optional.ofNullable(results.get(workItemId));
    }

    public Optional<String> failure(String workItemId) {
        return Optional.ofNullable(failures.get(workItemId));
    }
}
