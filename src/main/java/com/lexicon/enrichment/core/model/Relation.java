package com.lexicon.enrichment.core.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Directed, typed edge between two concepts.
 * Only created once the target has been resolved; idempotent on (source, target, type).
 */
public final class Relation {

    private static final Pattern NON_TYPE_CHARACTERS = Pattern.compile("[^\\p{L}0-9_]+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    private final String id;
    private final String sourceConceptId;
    private final String targetConceptId;
    private final String type;
    private final String note;
    private final String origin;
    private final Instant createdAt;

    private Relation(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.sourceConceptId = Objects.requireNonNull(builder.sourceConceptId, "sourceConceptId is required");
        this.targetConceptId = Objects.requireNonNull(builder.targetConceptId, "targetConceptId is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.note = builder.note;
        this.origin = builder.origin;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getSourceConceptId() {
        return sourceConceptId;
    }

    public String getTargetConceptId() {
        return targetConceptId;
    }

    public String getType() {
        return type;
    }

    public String getNote() {
        return note;
    }

    /**
     * Id of the work item or import entry this relation was derived from.
     */
    public String getOrigin() {
        return origin;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Lower-cases a freeform relation type and replaces every run of other characters with an underscore.
     *
     * @return the normalized type, or null if nothing usable remains
     */
    public static String normalizeType(String raw) {
        if (raw == null) {
            return null;
        }
        String type = NON_TYPE_CHARACTERS.matcher(raw.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
        type = EDGE_UNDERSCORES.matcher(type).replaceAll("");
        return type.isEmpty() ? null : type;
    }

    /**
     * Identity used for idempotent creation.
     */
    public String edgeKey() {
        return sourceConceptId + "|" + type + "|" + targetConceptId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relation relation = (Relation) o;
        return Objects.equals(id, relation.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Relation{" + sourceConceptId + " -[" + type + "]-> " + targetConceptId + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String sourceConceptId;
        private String targetConceptId;
        private String type;
        private String note;
        private String origin;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceConceptId(String sourceConceptId) {
            this.sourceConceptId = sourceConceptId;
            return this;
        }

        public Builder targetConceptId(String targetConceptId) {
            this.targetConceptId = targetConceptId;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder note(String note) {
            this.note = note;
            return this;
        }

        public Builder origin(String origin) {
            this.origin = origin;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Relation build() {
            return new Relation(this);
        }
    }
}
