package com.lexicon.enrichment.core.model;

/**
 * A freeform pointer from an enriched item to another headword, resolved through the cascade.
 *
 * @param targetTerm   the referenced term, as written by the oracle or the source dictionary
 * @param relationType relation type, e.g. "see_also" or "synonym"
 * @param note         optional note
 */
public record CrossReference(String targetTerm, String relationType, String note) {
}
