package com.lexicon.enrichment.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lexicon.enrichment.pipeline.RunProgress;

import java.util.List;

/**
 * Progress of the current or last run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressResponse(
        String runId,
        String status,
        int percentComplete,
        String details,
        String lastError,
        List<String> logs
) {
    public static ProgressResponse from(RunProgress progress) {
        return new ProgressResponse(
                progress.runId(),
                progress.status().name(),
                progress.percentComplete(),
                progress.details(),
                progress.lastError(),
                progress.logs()
        );
    }
}
