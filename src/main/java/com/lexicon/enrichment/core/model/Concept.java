package com.lexicon.enrichment.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Canonical dictionary concept, labelled in the canonical language.
 * Upserted by sense id when one exists, otherwise by label.
 */
public final class Concept {

    private final String id;
    private final String label;
    private final String partOfSpeech;
    private final String definition;
    private final String senseId;
    private final String notes;

    private Concept(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.label = Objects.requireNonNull(builder.label, "label is required");
        this.partOfSpeech = builder.partOfSpeech;
        this.definition = builder.definition;
        this.senseId = builder.senseId;
        this.notes = builder.notes;
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public String getPartOfSpeech() {
        return partOfSpeech;
    }

    public String getDefinition() {
        return definition;
    }

    public String getSenseId() {
        return senseId;
    }

    public String getNotes() {
        return notes;
    }

    /**
     * Key used for upserts: the sense id, or the label when the entry has no sense id.
     */
    public String naturalKey() {
        return senseId != null && !senseId.isBlank() ? senseId : label;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .label(label)
                .partOfSpeech(partOfSpeech)
                .definition(definition)
                .senseId(senseId)
                .notes(notes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Concept concept = (Concept) o;
        return Objects.equals(id, concept.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Concept{id='" + id + "', label='" + label + "', senseId='" + senseId + "'}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String label;
        private String partOfSpeech;
        private String definition;
        private String senseId;
        private String notes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder partOfSpeech(String partOfSpeech) {
            this.partOfSpeech = partOfSpeech;
            return this;
        }

        public Builder definition(String definition) {
            this.definition = definition;
            return this;
        }

        public Builder senseId(String senseId) {
            this.senseId = senseId;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Concept build() {
            return new Concept(this);
        }
    }
}
