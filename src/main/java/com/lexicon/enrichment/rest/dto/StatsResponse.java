package com.lexicon.enrichment.rest.dto;

import com.lexicon.enrichment.core.model.WorkStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Work item counts per ledger status.
 */
public record StatsResponse(Map<String, Long> counts, long total) {

    public static StatsResponse from(Map<WorkStatus, Long> byStatus) {
        Map<String, Long> counts = new LinkedHashMap<>();
        long total = 0;
        for (WorkStatus status : WorkStatus.values()) {
            long count = byStatus.getOrDefault(status, 0L);
            counts.put(status.name(), count);
            total += count;
        }
        return new StatsResponse(counts, total);
    }
}
