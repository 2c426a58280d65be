package com.lexicon.enrichment.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provider used when no oracle is configured. Every call fails, so the affected items end in ERROR.
 */
public class NoOpOracleProvider implements OracleProvider {
    private static final Logger log = LoggerFactory.getLogger(NoOpOracleProvider.class);

    @Override
    public JsonNode complete(String prompt) {
        log.debug("oracle.noop prompt_length={}", prompt.length());
        throw new OracleException("No oracle provider configured");
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
