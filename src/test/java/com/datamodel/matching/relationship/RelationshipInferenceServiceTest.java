package com.datamodel.matching.relationship;

import com.datamodel.matching.core.model.Domain;
import com.datamodel.matching.core.model.InferenceStatus;
import com.datamodel.matching.core.model.LogicalAttribute;
import com.datamodel.matching.core.model.LogicalEntity;
import com.datamodel.matching.exception.NotFoundException;
import com.datamodel.matching.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RelationshipInferenceServiceTest {

    private static final double EPSILON = 1e-9;

    private RelationshipInferenceService service;
    private InMemoryRelationshipRepository repository;

    @Mock
    private MetricsService metricsService;

    @BeforeEach
    void setUp() {
        InMemoryDomainDirectory directory = new InMemoryDomainDirectory().register(new Domain("d-1", "Claims", List.of(
                new LogicalEntity("e-claim", "Claim", List.of(LogicalAttribute.named("claim_id"))),
                new LogicalEntity("e-member", "Member", List.of(LogicalAttribute.named("member_id"))),
                new LogicalEntity("e-provider", "Provider", List.of(LogicalAttribute.named("provider_id")))
        )));
        repository = new InMemoryRelationshipRepository();
        service = new RelationshipInferenceService(directory, repository, metricsService);
    }

    private static SourceProfile claimSource(ForeignKeyHint... hints) {
        return new SourceProfile("claim", 1000, List.of(hints));
    }

    private static ForeignKeyHint memberHint(long matches) {
        return new ForeignKeyHint("member_id", "member", "member_id", matches, null, "claim belongs to member");
    }

    private RelationshipRecord existing(InferenceStatus status, ForeignKeyEvidence evidence) {
        return repository.save(RelationshipRecord.builder()
                .domainId("d-1")
                .fromEntityId("e-claim")
                .toEntityId("e-member")
                .relationshipType(RelationshipInferenceService.DEFAULT_RELATIONSHIP_TYPE)
                .status(status)
                .evidence(evidence)
                .build());
    }

    private static ForeignKeyEvidence oldEvidence() {
        return new ForeignKeyEvidence("claim", "member_id", "member", "member_id", 10, 1, 0.1);
    }

    @Test
    @DisplayName("Should create a pending relationship with evidence")
    void testCreatesPending() {
        List<RelationshipRecord> inferred = service.inferRelationships("d-1", List.of(claimSource(memberHint(950))));

        assertEquals(1, inferred.size());
        RelationshipRecord relationship = inferred.get(0);
        assertEquals(InferenceStatus.PENDING, relationship.getStatus());
        assertEquals("e-claim", relationship.getFromEntityId());
        assertEquals("e-member", relationship.getToEntityId());
        assertEquals("inferred_foreign_key", relationship.getRelationshipType());
        assertEquals("claim belongs to member", relationship.getDescription());
        assertEquals(0.95, relationship.getEvidence().coverage(), EPSILON);
        assertEquals(1000, relationship.getEvidence().rowCount());
        verify(metricsService).incrementRelationshipInferred(InferenceStatus.PENDING);
    }

    @Test
    @DisplayName("Should update the same row on repeated runs")
    void testIdempotentKey() {
        RelationshipRecord first = service.inferRelationships("d-1", List.of(claimSource(memberHint(500)))).get(0);
        RelationshipRecord second = service.inferRelationships("d-1", List.of(claimSource(memberHint(900)))).get(0);

        assertEquals(first.getId(), second.getId());
        assertEquals(1, repository.findByDomain("d-1").size());
        assertEquals(0.9, second.getEvidence().coverage(), EPSILON);
    }

    @Test
    @DisplayName("Should keep one row per relationship type")
    void testDistinctTypes() {
        ForeignKeyHint billed = new ForeignKeyHint("billing_provider_id", "provider", null, 10, "billed_by", null);
        ForeignKeyHint rendered = new ForeignKeyHint("rendering_provider_id", "provider", null, 10, "rendered_by", null);

        service.inferRelationships("d-1", List.of(claimSource(billed, rendered)));

        assertEquals(2, repository.findByDomain("d-1").size());
        assertTrue(repository.findByKey(new RelationshipKey("d-1", "e-claim", "e-provider", "billed_by")).isPresent());
        assertTrue(repository.findByKey(new RelationshipKey("d-1", "e-claim", "e-provider", "rendered_by")).isPresent());
    }

    @Test
    @DisplayName("Should leave manual relationships without evidence untouched")
    void testManualUntouched() {
        RelationshipRecord manual = existing(InferenceStatus.MANUAL, null);

        List<RelationshipRecord> inferred = service.inferRelationships("d-1", List.of(claimSource(memberHint(950))));

        assertTrue(inferred.isEmpty());
        RelationshipRecord stored = repository.findById(manual.getId()).orElseThrow();
        assertEquals(InferenceStatus.MANUAL, stored.getStatus());
        assertNull(stored.getEvidence());
        assertNull(stored.getDescription());
        verify(metricsService).incrementRelationshipSkipped();
    }

    @Test
    @DisplayName("Should move manual relationships with prior evidence to pending")
    void testManualWithEvidence() {
        RelationshipRecord manual = existing(InferenceStatus.MANUAL, oldEvidence());

        service.inferRelationships("d-1", List.of(claimSource(memberHint(950))));

        RelationshipRecord stored = repository.findById(manual.getId()).orElseThrow();
        assertEquals(InferenceStatus.PENDING, stored.getStatus());
        assertEquals(0.95, stored.getEvidence().coverage(), EPSILON);
    }

    @Test
    @DisplayName("Should revive rejected relationships as pending")
    void testRejectedRevived() {
        RelationshipRecord rejected = existing(InferenceStatus.REJECTED, oldEvidence());

        service.inferRelationships("d-1", List.of(claimSource(memberHint(950))));

        assertEquals(InferenceStatus.PENDING, repository.findById(rejected.getId()).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Should refresh evidence of approved relationships without reopening them")
    void testApprovedKept() {
        RelationshipRecord approved = existing(InferenceStatus.APPROVED, oldEvidence());

        service.inferRelationships("d-1", List.of(claimSource(memberHint(950))));

        RelationshipRecord stored = repository.findById(approved.getId()).orElseThrow();
        assertEquals(InferenceStatus.APPROVED, stored.getStatus());
        assertEquals(0.95, stored.getEvidence().coverage(), EPSILON);
    }

    @Test
    @DisplayName("Should ignore sources and targets that are not entities of the domain")
    void testUnknownSourcesIgnored() {
        ForeignKeyHint toUnknown = new ForeignKeyHint("widget_id", "widget", null, 5, null, null);

        List<RelationshipRecord> inferred = service.inferRelationships("d-1", List.of(
                new SourceProfile("invoice", 100, List.of(memberHint(10))),
                claimSource(toUnknown)));

        assertTrue(inferred.isEmpty());
        assertTrue(repository.findByDomain("d-1").isEmpty());
    }

    @Test
    @DisplayName("Should match source names case-insensitively")
    void testCaseInsensitiveSource() {
        List<RelationshipRecord> inferred = service.inferRelationships("d-1", List.of(
                new SourceProfile(" CLAIM ", 100, List.of(
                        new ForeignKeyHint("member_id", "Member", null, 100, null, null)))));

        assertEquals(1, inferred.size());
        assertEquals(1.0, inferred.get(0).getEvidence().coverage(), EPSILON);
    }

    @Test
    @DisplayName("Should throw NotFoundException for unknown domains")
    void testUnknownDomain() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> service.inferRelationships("missing", List.of()));
        assertEquals("Domain missing does not exist", e.getMessage());
    }

    @Test
    @DisplayName("Should let reviewers approve and reject suggestions")
    void testReview() {
        RelationshipRecord relationship = service.inferRelationships("d-1",
                List.of(claimSource(memberHint(950)))).get(0);

        assertEquals(InferenceStatus.APPROVED, service.approve(relationship.getId()).getStatus());
        assertEquals(InferenceStatus.REJECTED, service.reject(relationship.getId()).getStatus());
        assertThrows(NotFoundException.class, () -> service.approve("missing"));
    }

    @Test
    @DisplayName("Should not allow reviewing manual relationships")
    void testManualNotReviewable() {
        RelationshipRecord manual = existing(InferenceStatus.MANUAL, null);

        assertThrows(IllegalStateException.class, () -> service.approve(manual.getId()));
        assertThrows(IllegalStateException.class, () -> service.reject(manual.getId()));
    }
}
