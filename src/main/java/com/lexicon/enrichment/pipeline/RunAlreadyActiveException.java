package com.lexicon.enrichment.pipeline;

public class RunAlreadyActiveException extends RuntimeException {

    public RunAlreadyActiveException(String pipeline) {
        super("A " + pipeline + " run is already in progress");
    }
}
