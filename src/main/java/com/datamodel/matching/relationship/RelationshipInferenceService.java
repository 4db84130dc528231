package com.datamodel.matching.relationship;

import com.datamodel.matching.core.model.Domain;
import com.datamodel.matching.core.model.InferenceStatus;
import com.datamodel.matching.core.model.LogicalEntity;
import com.datamodel.matching.exception.NotFoundException;
import com.datamodel.matching.logging.LogContext;
import com.datamodel.matching.metrics.MetricsService;
import com.datamodel.matching.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns profiled foreign-key matches into pending relationship suggestions.
 *
 * <p>For every source whose name matches an entity of the domain, and every foreign
 * key whose referenced source matches another entity, the relationship row keyed by
 * (domain, from, to, type) is fetched or created as {@link InferenceStatus#PENDING}
 * and given fresh {@link ForeignKeyEvidence}. The row's {@link InferenceStatus}
 * decides whether it may be touched and where it moves; user-authored rows that
 * never carried evidence are left exactly as they are.</p>
 */
public class RelationshipInferenceService {
    private static final Logger log = LoggerFactory.getLogger(RelationshipInferenceService.class);

    public static final String DEFAULT_RELATIONSHIP_TYPE = "inferred_foreign_key";

    private final DomainDirectory domainDirectory;
    private final RelationshipRepository repository;
    private final MetricsService metricsService;

    public RelationshipInferenceService(DomainDirectory domainDirectory, RelationshipRepository repository) {
        this(domainDirectory, repository, new NoOpMetricsService());
    }

    public RelationshipInferenceService(DomainDirectory domainDirectory, RelationshipRepository repository,
                                        MetricsService metricsService) {
        this.domainDirectory = domainDirectory;
        this.repository = repository;
        this.metricsService = metricsService;
    }

    /**
     * Creates or updates relationship suggestions for a domain.
     *
     * @param domainId identifier of the profiled domain
     * @param sources  profiling summaries of the domain's sources
     * @return the relationships that received evidence, in source order
     * @throws NotFoundException if the domain does not exist
     */
    public List<RelationshipRecord> inferRelationships(String domainId, List<SourceProfile> sources) {
        Domain domain = domainDirectory.findById(domainId)
                .orElseThrow(() -> new NotFoundException("Domain", domainId));

        try (LogContext ignored = LogContext.forInference(LogContext.generateCorrelationId(), domainId)) {
            List<RelationshipRecord> inferred = new ArrayList<>();
            int skipped = 0;

            for (SourceProfile source : sources != null ? sources : List.<SourceProfile>of()) {
                if (source == null || source.name().isEmpty()) {
                    continue;
                }
                Optional<LogicalEntity> fromEntity = domain.entityNamed(source.name());
                if (fromEntity.isEmpty()) {
                    log.debug("Source '{}' does not match an entity of domain {}", source.name(), domainId);
                    continue;
                }

                for (ForeignKeyHint hint : source.foreignKeys()) {
                    ForeignKeyEvidence evidence = ForeignKeyEvidence.from(source.name(), source.rowCount(), hint);
                    Optional<LogicalEntity> toEntity = domain.entityNamed(evidence.target());
                    if (toEntity.isEmpty()) {
                        continue;
                    }

                    RelationshipKey key = new RelationshipKey(domain.id(), entityKey(fromEntity.get()),
                            entityKey(toEntity.get()), relationshipType(hint));
                    RelationshipRecord relationship = getOrCreate(key);
                    if (!relationship.acceptsEvidence()) {
                        skipped++;
                        metricsService.incrementRelationshipSkipped();
                        log.debug("Leaving manual relationship {} untouched", relationship.getId());
                        continue;
                    }

                    InferenceStatus before = relationship.getStatus();
                    relationship.applyEvidence(evidence, hint.description());
                    repository.save(relationship);
                    metricsService.incrementRelationshipInferred(relationship.getStatus());
                    if (before != relationship.getStatus()) {
                        log.info("relationship.status relationshipId={} from={} to={}",
                                relationship.getId(), before, relationship.getStatus());
                    }
                    inferred.add(relationship);
                }
            }

            log.info("relationship.inferred domainId={} updated={} skippedManual={}",
                    domainId, inferred.size(), skipped);
            return inferred;
        }
    }

    /**
     * Approves a relationship suggestion.
     *
     * @throws NotFoundException     if the relationship does not exist
     * @throws IllegalStateException if the relationship is user-authored
     */
    public RelationshipRecord approve(String relationshipId) {
        RelationshipRecord relationship = require(relationshipId);
        relationship.markApproved();
        repository.save(relationship);
        log.info("relationship.approved relationshipId={}", relationshipId);
        return relationship;
    }

    /**
     * Rejects a relationship suggestion. Fresh evidence will re-propose it.
     *
     * @throws NotFoundException     if the relationship does not exist
     * @throws IllegalStateException if the relationship is user-authored
     */
    public RelationshipRecord reject(String relationshipId) {
        RelationshipRecord relationship = require(relationshipId);
        relationship.markRejected();
        repository.save(relationship);
        log.info("relationship.rejected relationshipId={}", relationshipId);
        return relationship;
    }

    private RelationshipRecord require(String relationshipId) {
        return repository.findById(relationshipId)
                .orElseThrow(() -> new NotFoundException("Relationship", relationshipId));
    }

    private RelationshipRecord getOrCreate(RelationshipKey key) {
        return repository.findByKey(key).orElseGet(() -> repository.save(RelationshipRecord.builder()
                .domainId(key.domainId())
                .fromEntityId(key.fromEntityId())
                .toEntityId(key.toEntityId())
                .relationshipType(key.relationshipType())
                .status(InferenceStatus.PENDING)
                .build()));
    }

    private static String relationshipType(ForeignKeyHint hint) {
        String type = hint.relationshipType();
        return type != null && !type.isBlank() ? type.trim() : DEFAULT_RELATIONSHIP_TYPE;
    }

    private static String entityKey(LogicalEntity entity) {
        return entity.id() != null ? entity.id() : entity.name();
    }

    public RelationshipRepository getRepository() {
        return repository;
    }
}
