package com.lexicon.enrichment.rest.dto;

/**
 * Returned when a run was accepted and started in the background.
 */
public record StartResponse(boolean accepted, int limit, String runId) {

    public static StartResponse accepted(int limit, String runId) {
        return new StartResponse(true, limit, runId);
    }
}
