package com.lexicon.enrichment.oracle;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * External text-generation service answering a prompt with a single JSON value.
 *
 * <p>Implementations make exactly one attempt per call. Retrying is the caller's concern.</p>
 */
public interface OracleProvider {

    /**
     * @return the parsed JSON answer
     * @throws RateLimitedException           if the service asks the caller to slow down
     * @throws InvalidOracleResponseException if the answer is not parseable JSON
     * @throws OracleException                on any other failure
     */
    JsonNode complete(String prompt);

    String getProviderName();

    /**
     * Whether the service is reachable and configured.
     */
    boolean isAvailable();
}
