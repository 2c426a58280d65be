package com.lexicon.enrichment.resolution;

/**
 * Result of running a reference through the cascade.
 *
 * @param term      the dirty reference as given
 * @param conceptId the resolved concept, or null when every strategy missed
 * @param strategy  name of the strategy that matched, or null
 * @param candidate the cleaned or rewritten form that matched, or null
 */
public record ResolutionOutcome(String term, String conceptId, String strategy, String candidate) {

    public static ResolutionOutcome unresolved(String term) {
        return new ResolutionOutcome(term, null, null, null);
    }

    public boolean resolved() {
        return conceptId != null;
    }
}
