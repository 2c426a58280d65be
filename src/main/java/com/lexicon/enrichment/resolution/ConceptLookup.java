package com.lexicon.enrichment.resolution;

import java.util.Optional;

/**
 * Read-only exact lookups used by the resolution strategies.
 */
public interface ConceptLookup {

    /**
     * Concept whose canonical label equals {@code label} exactly (case-sensitive).
     */
    Optional<String> findIdByLabel(String label);

    /**
     * Concept denoted by the source-language term {@code term}.
     */
    Optional<String> findIdBySourceTerm(String term);
}
