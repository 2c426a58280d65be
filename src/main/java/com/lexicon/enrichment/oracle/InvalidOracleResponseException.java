package com.lexicon.enrichment.oracle;

/**
 * The oracle answered, but the answer is not a JSON object of the expected shape. Not retryable.
 */
public class InvalidOracleResponseException extends OracleException {

    public InvalidOracleResponseException(String message) {
        super(message);
    }

    public InvalidOracleResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
