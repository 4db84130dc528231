package com.datamodel.matching.mapping;

import com.datamodel.matching.core.model.LogicalAttribute;
import com.datamodel.matching.core.model.LogicalEntity;
import com.datamodel.matching.core.model.MappingStatus;
import com.datamodel.matching.core.model.PhysicalColumn;
import com.datamodel.matching.core.model.PhysicalTable;
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
class MappingDraftServiceTest {

    private MappingDraftService service;
    private InMemoryMappingRepository repository;

    @Mock
    private MetricsService metricsService;

    private LogicalEntity member;
    private List<PhysicalTable> tables;

    @BeforeEach
    void setUp() {
        repository = new InMemoryMappingRepository();
        service = new MappingDraftService(new MappingPlanner(), repository, metricsService);

        member = new LogicalEntity("e-member", "Member", List.of(
                new LogicalAttribute("a-id", "member_id", "string", "identifier", true),
                new LogicalAttribute("a-dob", "dob", "date", null, false)
        ));
        tables = List.of(new PhysicalTable("t-member", "claims.member", List.of(
                new PhysicalColumn("member_id", "varchar"),
                new PhysicalColumn("dob", "date")
        )));
    }

    @Test
    @DisplayName("Should create one draft per planned attribute")
    void testCreatesDrafts() {
        DraftPlanResult result = service.planAndSaveDrafts(member, tables);

        assertEquals(2, result.drafts().size());
        assertEquals(2, result.createdCount());
        assertEquals(0, result.updatedCount());

        DraftMapping draft = repository.findDraftByAttribute("a-id").orElseThrow();
        assertEquals("claims.member.member_id", draft.getColumnPath());
        assertEquals("t-member", draft.getSourceTableId());
        assertEquals("e-member", draft.getEntityId());
        assertEquals(MappingStatus.DRAFT, draft.getStatus());
        verify(metricsService, times(2)).incrementDraftMappingSaved(true);
    }

    @Test
    @DisplayName("Should refresh existing drafts instead of adding new rows")
    void testRefreshesDrafts() {
        DraftMapping original = service.planAndSaveDrafts(member, tables).drafts().get(0);

        DraftPlanResult second = service.planAndSaveDrafts(member, tables);

        assertEquals(0, second.createdCount());
        assertEquals(2, second.updatedCount());
        assertEquals(1, repository.findByAttribute("a-id").size());
        assertEquals(original.getId(), repository.findDraftByAttribute("a-id").orElseThrow().getId());
        verify(metricsService, times(2)).incrementDraftMappingSaved(false);
    }

    @Test
    @DisplayName("Should not touch approved mappings when re-planning")
    void testApprovedMappingsKept() {
        DraftMapping draft = service.planAndSaveDrafts(member, tables).drafts().get(0);
        service.approve(draft.getId());

        service.planAndSaveDrafts(member, tables);

        List<DraftMapping> rows = repository.findByAttribute("a-id");
        assertEquals(2, rows.size());
        assertEquals(MappingStatus.APPROVED, repository.findById(draft.getId()).orElseThrow().getStatus());
        assertTrue(repository.findDraftByAttribute("a-id").isPresent());
    }

    @Test
    @DisplayName("Should skip attributes without an id or a source table")
    void testSkipsUnaddressable() {
        LogicalEntity draftEntity = new LogicalEntity(null, "Member", List.of(LogicalAttribute.named("member_id")));
        List<PhysicalTable> adHoc = List.of(new PhysicalTable(null, "member", List.of(
                new PhysicalColumn("member_id", "varchar"))));

        DraftPlanResult withoutId = service.planAndSaveDrafts(draftEntity, tables);
        DraftPlanResult withoutTable = service.planAndSaveDrafts(member, adHoc);

        assertTrue(withoutId.drafts().isEmpty());
        assertEquals(1, withoutId.plans().size());
        assertTrue(withoutTable.drafts().isEmpty());
    }

    @Test
    @DisplayName("Should approve and reject drafts once")
    void testReview() {
        List<DraftMapping> drafts = service.planAndSaveDrafts(member, tables).drafts();

        assertEquals(MappingStatus.APPROVED, service.approve(drafts.get(0).getId()).getStatus());
        assertEquals(MappingStatus.REJECTED, service.reject(drafts.get(1).getId()).getStatus());

        assertThrows(IllegalStateException.class, () -> service.approve(drafts.get(0).getId()));
        assertThrows(IllegalStateException.class, () -> service.reject(drafts.get(1).getId()));
    }

    @Test
    @DisplayName("Should throw NotFoundException for unknown mappings")
    void testUnknownMapping() {
        NotFoundException e = assertThrows(NotFoundException.class, () -> service.approve("missing"));
        assertEquals("Mapping missing does not exist", e.getMessage());
    }
}
