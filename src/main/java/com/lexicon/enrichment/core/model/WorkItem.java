package com.lexicon.enrichment.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A unit of enrichment work: one source-language sentence or dictionary example.
 *
 * <p>Work items are immutable snapshots; status transitions go through the
 * {@code JobLedger}, which hands out new snapshots.</p>
 */
public final class WorkItem {

    private final String id;
    private final String sourceText;
    private final String targetHint;
    private final String parentId;
    private final int sequenceNumber;
    private final WorkItemKind kind;
    private final String note;
    private final WorkStatus status;
    private final String errorMessage;
    private final Instant updatedAt;

    private WorkItem(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.sourceText = Objects.requireNonNull(builder.sourceText, "sourceText is required");
        this.targetHint = builder.targetHint;
        this.parentId = builder.parentId;
        this.sequenceNumber = builder.sequenceNumber;
        this.kind = builder.kind != null ? builder.kind : WorkItemKind.CORPUS_SENTENCE;
        this.note = builder.note;
        this.status = builder.status != null ? builder.status : WorkStatus.PENDING;
        this.errorMessage = builder.errorMessage;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getSourceText() {
        return sourceText;
    }

    /**
     * Raw translation that came with the source text, if any. Used as a hint only.
     */
    public String getTargetHint() {
        return targetHint;
    }

    /**
     * Id of the concept (dictionary entry or text) this item belongs to.
     */
    public String getParentId() {
        return parentId;
    }

    public int getSequenceNumber() {
        return sequenceNumber;
    }

    public WorkItemKind getKind() {
        return kind;
    }

    public String getNote() {
        return note;
    }

    public WorkStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Returns a copy with a new status. The error message is kept only for {@link WorkStatus#ERROR}.
     */
    public WorkItem withStatus(WorkStatus newStatus, String message) {
        return toBuilder()
                .status(newStatus)
                .errorMessage(newStatus == WorkStatus.ERROR ? message : null)
                .updatedAt(Instant.now())
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .sourceText(sourceText)
                .targetHint(targetHint)
                .parentId(parentId)
                .sequenceNumber(sequenceNumber)
                .kind(kind)
                .note(note)
                .status(status)
                .errorMessage(errorMessage)
                .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkItem that = (WorkItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkItem{" +
                "id='" + id + '\'' +
                ", parentId='" + parentId + '\'' +
                ", sequenceNumber=" + sequenceNumber +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String sourceText;
        private String targetHint;
        private String parentId;
        private int sequenceNumber;
        private WorkItemKind kind;
        private String note;
        private WorkStatus status;
        private String errorMessage;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceText(String sourceText) {
            this.sourceText = sourceText;
            return this;
        }

        public Builder targetHint(String targetHint) {
            this.targetHint = targetHint;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder sequenceNumber(int sequenceNumber) {
            this.sequenceNumber = sequenceNumber;
            return this;
        }

        public Builder kind(WorkItemKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder note(String note) {
            this.note = note;
            return this;
        }

        public Builder status(WorkStatus status) {
            this.status = status;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public WorkItem build() {
            return new WorkItem(this);
        }
    }
}
