package com.lexicon.enrichment.bulk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One sense of a headword in a structured dictionary file.
 *
 * <pre>
 * {"headword": "Haus", "partOfSpeech": "n", "senseId": "haus-1", "germanDefinition": "...",
 *  "usageNotes": ["..."],
 *  "translations": [{"term": "Hus", "gender": "n", "plural": "Hüser"}],
 *  "examples": [{"halunder": "...", "german": "..."}],
 *  "relations": [{"targetTerm": "Hof²", "type": "see_also"}]}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DictionaryEntry(
        String headword,
        String partOfSpeech,
        String senseId,
        String germanDefinition,
        List<String> usageNotes,
        List<Translation> translations,
        List<Example> examples,
        List<RelationEntry> relations
) {
    public DictionaryEntry {
        usageNotes = usageNotes != null ? List.copyOf(usageNotes) : List.of();
        translations = translations != null ? List.copyOf(translations) : List.of();
        examples = examples != null ? List.copyOf(examples) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Translation(
            String term,
            String pronunciation,
            String gender,
            String plural,
            String etymology,
            String note
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Example(
            String halunder,
            String german,
            String note
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RelationEntry(
            String targetTerm,
            String type,
            String note
    ) {}
}
