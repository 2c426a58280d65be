package com.lexicon.enrichment.core.model;

/**
 * Origin of a work item.
 */
public enum WorkItemKind {
    /** A sentence segmented out of a running source-language text. */
    CORPUS_SENTENCE("corpus_sentences"),
    /** A usage example attached to a dictionary entry. */
    DICTIONARY_EXAMPLE("dictionary_examples");

    private final String sourceTable;

    WorkItemKind(String sourceTable) {
        this.sourceTable = sourceTable;
    }

    /**
     * Name recorded as the source table of highlights derived from items of this kind.
     */
    public String sourceTable() {
        return sourceTable;
    }
}
