package com.datamodel.matching.mapping;

import com.datamodel.matching.core.model.MappingCandidate;
import com.datamodel.matching.core.model.MappingStatus;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted mapping of a logical attribute onto a source column.
 * Planning runs keep at most one {@link MappingStatus#DRAFT} row per attribute and
 * refresh it in place; approved and rejected rows are only changed by a reviewer.
 */
public class DraftMapping {

    private final String id;
    private final String attributeId;
    private String entityId;
    private String sourceTableId;
    private String columnPath;
    private double confidence;
    private String rationale;
    private MappingStatus status;
    private final Instant createdAt;
    private Instant updatedAt;

    private DraftMapping(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.attributeId = Objects.requireNonNull(builder.attributeId, "attributeId is required");
        this.entityId = builder.entityId;
        this.sourceTableId = builder.sourceTableId;
        this.columnPath = builder.columnPath;
        this.confidence = builder.confidence;
        this.rationale = builder.rationale;
        this.status = builder.status != null ? builder.status : MappingStatus.DRAFT;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getAttributeId() {
        return attributeId;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getSourceTableId() {
        return sourceTableId;
    }

    public String getColumnPath() {
        return columnPath;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getRationale() {
        return rationale;
    }

    public MappingStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isDraft() {
        return status == MappingStatus.DRAFT;
    }

    void refreshFrom(String entityId, MappingCandidate candidate) {
        this.entityId = entityId;
        this.sourceTableId = candidate.sourceTableId();
        this.columnPath = candidate.columnPath();
        this.confidence = candidate.confidence();
        this.rationale = candidate.rationale();
        this.updatedAt = Instant.now();
    }

    void markApproved() {
        this.status = MappingStatus.APPROVED;
        this.updatedAt = Instant.now();
    }

    void markRejected() {
        this.status = MappingStatus.REJECTED;
        this.updatedAt = Instant.now();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DraftMapping that = (DraftMapping) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "DraftMapping{" +
                "id='" + id + '\'' +
                ", attributeId='" + attributeId + '\'' +
                ", columnPath='" + columnPath + '\'' +
                ", confidence=" + confidence +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a draft from a planner candidate.
     */
    public static Builder fromCandidate(String entityId, String attributeId, MappingCandidate candidate) {
        return new Builder()
                .entityId(entityId)
                .attributeId(attributeId)
                .sourceTableId(candidate.sourceTableId())
                .columnPath(candidate.columnPath())
                .confidence(candidate.confidence())
                .rationale(candidate.rationale())
                .status(MappingStatus.DRAFT);
    }

    public static class Builder {
        private String id;
        private String attributeId;
        private String entityId;
        private String sourceTableId;
        private String columnPath;
        private double confidence;
        private String rationale;
        private MappingStatus status;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder attributeId(String attributeId) {
            this.attributeId = attributeId;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder sourceTableId(String sourceTableId) {
            this.sourceTableId = sourceTableId;
            return this;
        }

        public Builder columnPath(String columnPath) {
            this.columnPath = columnPath;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder rationale(String rationale) {
            this.rationale = rationale;
            return this;
        }

        public Builder status(MappingStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public DraftMapping build() {
            return new DraftMapping(this);
        }
    }
}
