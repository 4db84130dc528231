package com.datamodel.matching.relationship;

import java.util.List;
import java.util.Optional;

/**
 * Storage for relationship rows.
 * Implementations own their transaction boundary; each save is one relationship row.
 */
public interface RelationshipRepository {

    /**
     * Saves a new relationship or replaces the stored one with the same id.
     */
    RelationshipRecord save(RelationshipRecord relationship);

    /**
     * Finds a relationship by id.
     */
    Optional<RelationshipRecord> findById(String relationshipId);

    /**
     * Finds the relationship with the given identity key.
     */
    Optional<RelationshipRecord> findByKey(RelationshipKey key);

    /**
     * Lists the relationships of a domain.
     */
    List<RelationshipRecord> findByDomain(String domainId);
}
