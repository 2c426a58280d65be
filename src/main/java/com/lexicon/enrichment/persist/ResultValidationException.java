package com.lexicon.enrichment.persist;

/**
 * The oracle result for one work item lacks a required field.
 */
public class ResultValidationException extends RuntimeException {

    private final String workItemId;

    public ResultValidationException(String workItemId, String message) {
        super(message);
        this.workItemId = workItemId;
    }

    public String getWorkItemId() {
        return workItemId;
    }
}
