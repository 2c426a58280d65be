package com.lexicon.enrichment.rest.dto;

/**
 * Request body of a start call.
 *
 * @param limit maximum number of items the run may select
 */
public record StartRequest(Integer limit) {
}
