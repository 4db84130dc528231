package com.datamodel.matching.relationship;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link RelationshipRepository}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryRelationshipRepository implements RelationshipRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRelationshipRepository.class);

    private final ConcurrentMap<String, RelationshipRecord> relationships = new ConcurrentHashMap<>();

    @Override
    public RelationshipRecord save(RelationshipRecord relationship) {
        relationships.put(relationship.getId(), relationship);
        log.debug("Saved relationship {} ({} -> {}, type={}, status={})",
                relationship.getId(), relationship.getFromEntityId(), relationship.getToEntityId(),
                relationship.getRelationshipType(), relationship.getStatus());
        return relationship;
    }

    @Override
    public Optional<RelationshipRecord> findById(String relationshipId) {
        return Optional.ofNullable(relationships.get(relationshipId));
    }

    @Override
    public Optional<RelationshipRecord> findByKey(RelationshipKey key) {
        return relationships.values().stream()
                .filter(r -> r.key().equals(key))
                .min(Comparator.comparing(RelationshipRecord::getCreatedAt));
    }

    @Override
    public List<RelationshipRecord> findByDomain(String domainId) {
        return relationships.values().stream()
                .filter(r -> r.getDomainId().equals(domainId))
                .sorted(Comparator.comparing(RelationshipRecord::getCreatedAt))
                .toList();
    }
}
