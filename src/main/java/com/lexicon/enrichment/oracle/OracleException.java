package com.lexicon.enrichment.oracle;

/**
 * Failure of an oracle call that retrying will not fix.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
