package com.lexicon.enrichment.core.model;

import java.util.Objects;

/**
 * A term in one language linked to a concept, with its lexical metadata.
 *
 * @param text          term text as written
 * @param language      language of the term
 * @param conceptId     the linked concept
 * @param pronunciation pronunciation, may be null
 * @param gender        grammatical gender, may be null
 * @param pluralForm    plural form, may be null
 * @param etymology     etymology, may be null
 * @param note          usage note, may be null
 * @param sourceName    name of the dictionary the link was imported from, may be null
 */
public record TermLink(
        String text,
        Language language,
        String conceptId,
        String pronunciation,
        String gender,
        String pluralForm,
        String etymology,
        String note,
        String sourceName
) {
    public TermLink {
        Objects.requireNonNull(text, "text is required");
        Objects.requireNonNull(language, "language is required");
        Objects.requireNonNull(conceptId, "conceptId is required");
        text = text.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("text must not be blank");
        }
    }

    public static TermLink of(String text, Language language, String conceptId) {
        return new TermLink(text, language, conceptId, null, null, null, null, null, null);
    }
}
