package com.datamodel.matching.core.model;

/**
 * A proposed relationship between two logical entities.
 *
 * @param fromEntity child entity name
 * @param toEntity   parent entity name
 * @param type       relationship type; evidence-based classification overrides it
 * @param rule       optional free-text business rule
 * @param evidence   supporting evidence, never null
 */
public record RelationshipProposal(String fromEntity, String toEntity, String type, String rule, FkEvidence evidence) {

    public static final String DEFAULT_TYPE = "one_to_many";

    public RelationshipProposal {
        fromEntity = fromEntity != null ? fromEntity.trim() : "";
        toEntity = toEntity != null ? toEntity.trim() : "";
        type = type != null && !type.isBlank() ? type.trim() : DEFAULT_TYPE;
        evidence = evidence != null ? evidence : FkEvidence.none();
    }

    public RelationshipProposal(String fromEntity, String toEntity, String type, String rule) {
        this(fromEntity, toEntity, type, rule, FkEvidence.none());
    }

    public RelationshipProposal withEvidence(String resolvedType, FkEvidence newEvidence) {
        return new RelationshipProposal(fromEntity, toEntity, resolvedType, rule, newEvidence);
    }
}
