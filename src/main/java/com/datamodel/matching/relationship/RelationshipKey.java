package com.datamodel.matching.relationship;

import java.util.Objects;

/**
 * Identity of a relationship for inference purposes. A different relationship
 * type is a different relationship.
 */
public record RelationshipKey(String domainId, String fromEntityId, String toEntityId, String relationshipType) {

    public RelationshipKey {
        Objects.requireNonNull(domainId, "domainId is required");
        Objects.requireNonNull(fromEntityId, "fromEntityId is required");
        Objects.requireNonNull(toEntityId, "toEntityId is required");
        Objects.requireNonNull(relationshipType, "relationshipType is required");
    }
}
