package com.lexicon.enrichment.pipeline;

public enum RunStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
