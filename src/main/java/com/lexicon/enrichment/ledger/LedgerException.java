package com.lexicon.enrichment.ledger;

/**
 * Thrown when the ledger store cannot be read or written.
 * A ledger failure aborts the whole run; items already claimed stay in processing until the next reset.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
