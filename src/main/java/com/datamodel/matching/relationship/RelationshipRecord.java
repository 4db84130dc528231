package com.datamodel.matching.relationship;

import com.datamodel.matching.core.model.InferenceStatus;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted relationship between two entities of a domain, with its review state
 * and the most recent inference evidence.
 *
 * <p>Status changes go through {@link InferenceStatus}: inference uses
 * {@link #applyEvidence}, reviewers use {@link #markApproved()} and
 * {@link #markRejected()}.</p>
 */
public class RelationshipRecord {

    private final String id;
    private final String domainId;
    private final String fromEntityId;
    private final String toEntityId;
    private final String relationshipType;
    private String description;
    private ForeignKeyEvidence evidence;
    private InferenceStatus status;
    private final Instant createdAt;
    private Instant updatedAt;

    private RelationshipRecord(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.domainId = Objects.requireNonNull(builder.domainId, "domainId is required");
        this.fromEntityId = Objects.requireNonNull(builder.fromEntityId, "fromEntityId is required");
        this.toEntityId = Objects.requireNonNull(builder.toEntityId, "toEntityId is required");
        this.relationshipType = Objects.requireNonNull(builder.relationshipType, "relationshipType is required");
        this.description = builder.description;
        this.evidence = builder.evidence;
        this.status = builder.status != null ? builder.status : InferenceStatus.PENDING;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getDomainId() {
        return domainId;
    }

    public String getFromEntityId() {
        return fromEntityId;
    }

    public String getToEntityId() {
        return toEntityId;
    }

    public String getRelationshipType() {
        return relationshipType;
    }

    public String getDescription() {
        return description;
    }

    public ForeignKeyEvidence getEvidence() {
        return evidence;
    }

    public InferenceStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean hasEvidence() {
        return evidence != null;
    }

    public RelationshipKey key() {
        return new RelationshipKey(domainId, fromEntityId, toEntityId, relationshipType);
    }

    /**
     * Whether an inference run may attach evidence to this row.
     */
    public boolean acceptsEvidence() {
        return status.acceptsEvidence(hasEvidence());
    }

    /**
     * Attaches fresh evidence and moves the status as {@link InferenceStatus#afterEvidence()} dictates.
     *
     * @throws IllegalStateException if the row does not accept evidence
     */
    void applyEvidence(ForeignKeyEvidence newEvidence, String newDescription) {
        if (!acceptsEvidence()) {
            throw new IllegalStateException("Relationship " + id + " does not accept inferred evidence in state " + status);
        }
        this.evidence = Objects.requireNonNull(newEvidence, "evidence is required");
        if (newDescription != null && !newDescription.isBlank()) {
            this.description = newDescription;
        }
        this.status = status.afterEvidence();
        this.updatedAt = Instant.now();
    }

    void markApproved() {
        requireReviewable();
        this.status = InferenceStatus.APPROVED;
        this.updatedAt = Instant.now();
    }

    void markRejected() {
        requireReviewable();
        this.status = InferenceStatus.REJECTED;
        this.updatedAt = Instant.now();
    }

    private void requireReviewable() {
        if (!status.isReviewable()) {
            throw new IllegalStateException("Relationship " + id + " is not open for review in state " + status);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RelationshipRecord that = (RelationshipRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "RelationshipRecord{" +
                "id='" + id + '\'' +
                ", fromEntityId='" + fromEntityId + '\'' +
                ", toEntityId='" + toEntityId + '\'' +
                ", type='" + relationshipType + '\'' +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String domainId;
        private String fromEntityId;
        private String toEntityId;
        private String relationshipType;
        private String description;
        private ForeignKeyEvidence evidence;
        private InferenceStatus status;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder domainId(String domainId) {
            this.domainId = domainId;
            return this;
        }

        public Builder fromEntityId(String fromEntityId) {
            this.fromEntityId = fromEntityId;
            return this;
        }

        public Builder toEntityId(String toEntityId) {
            this.toEntityId = toEntityId;
            return this;
        }

        public Builder relationshipType(String relationshipType) {
            this.relationshipType = relationshipType;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder evidence(ForeignKeyEvidence evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder status(InferenceStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public RelationshipRecord build() {
            return new RelationshipRecord(this);
        }
    }
}
