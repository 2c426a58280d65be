package com.lexicon.enrichment.core.model;

/**
 * Dictionary metadata for one sense of a source-language term, as seen by the context assembler.
 *
 * @param term          the source-language term text
 * @param conceptId     id of the linked concept
 * @param conceptLabel  canonical label of the linked concept
 * @param partOfSpeech  part of speech of the concept, may be null
 * @param definition    definition of the concept, may be null
 * @param pronunciation pronunciation of the term, may be null
 * @param gender        grammatical gender, may be null
 * @param pluralForm    plural form, may be null
 * @param etymology     etymology note, may be null
 * @param note          free-form usage note, may be null
 */
public record TermSense(
        String term,
        String conceptId,
        String conceptLabel,
        String partOfSpeech,
        String definition,
        String pronunciation,
        String gender,
        String pluralForm,
        String etymology,
        String note
) {
    public static TermSense of(String term, String conceptId, String conceptLabel) {
        return new TermSense(term, conceptId, conceptLabel, null, null, null, null, null, null, null);
    }
}
