package com.lexicon.enrichment.persist;

/**
 * What was written for one work item.
 *
 * @param workItemId           the work item
 * @param completed            whether the item reached COMPLETED
 * @param translations         translation rows written
 * @param highlightsWritten    highlights inserted or replaced
 * @param relationsCreated     new relations
 * @param unresolvedReferences cross-references skipped because their target was not found
 * @param error                error message when the item ended in ERROR
 */
public record PersistResult(
        String workItemId,
        boolean completed,
        int translations,
        int highlightsWritten,
        int relationsCreated,
        int unresolvedReferences,
        String error
) {
    public static PersistResult failed(String workItemId, String error) {
        return new PersistResult(workItemId, false, 0, 0, 0, 0, error);
    }
}
