package com.lexicon.enrichment.executor;

import java.time.Duration;

/**
 * An oracle call did not answer within the per-call timeout and was cancelled.
 */
public class OracleTimeoutException extends RuntimeException {

    public OracleTimeoutException(Duration timeout) {
        super("Oracle call did not answer within " + timeout.toMillis() + " ms and was cancelled");
    }
}
