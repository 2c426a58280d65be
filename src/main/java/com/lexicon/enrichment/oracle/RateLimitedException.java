package com.lexicon.enrichment.oracle;

/**
 * The oracle refused the call because of rate limiting (HTTP 429). Retryable.
 */
public class RateLimitedException extends OracleException {

    public RateLimitedException(String message) {
        super(message);
    }
}
