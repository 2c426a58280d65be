package com.lexicon.enrichment.bulk;

import java.util.List;

/**
 * Result of a dictionary import.
 *
 * @param totalEntries        entries read from the input
 * @param conceptsUpserted    concepts inserted or updated
 * @param termsLinked         term links written
 * @param examplesEnqueued    usage examples added to the ledger as new work items
 * @param relationsCreated    new relations
 * @param relationsUnresolved relations skipped because their target was not found
 * @param errors              entries or parts of entries that could not be imported
 */
public record ImportResult(
        long totalEntries,
        long conceptsUpserted,
        long termsLinked,
        long examplesEnqueued,
        long relationsCreated,
        long relationsUnresolved,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param entryNumber position of the entry in the input (1-based), 0 for input-level errors
     * @param headword    headword of the entry, empty if unknown
     * @param message     what went wrong
     */
    public record ImportError(long entryNumber, String headword, String message) {}

    @Override
    public String toString() {
        return "ImportResult{entries=" + totalEntries +
                ", concepts=" + conceptsUpserted +
                ", terms=" + termsLinked +
                ", examples=" + examplesEnqueued +
                ", relations=" + relationsCreated +
                ", unresolved=" + relationsUnresolved +
                ", errors=" + errors.size() + '}';
    }
}
