package com.datamodel.matching.coverage;

import com.datamodel.matching.core.model.Domain;
import com.datamodel.matching.core.model.LogicalAttribute;
import com.datamodel.matching.core.model.LogicalEntity;
import com.datamodel.matching.exception.NotFoundException;
import com.datamodel.matching.ontology.OntologyLoader;
import com.datamodel.matching.relationship.DomainDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OntologyCoverageAnalyzerTest {

    @Mock
    private DomainDirectory domainDirectory;

    private OntologyCoverageAnalyzer analyzer;
    private Domain domain;

    @BeforeEach
    void setUp() {
        analyzer = new OntologyCoverageAnalyzer(new OntologyLoader().loadDefault(), domainDirectory);
        domain = new Domain("d-1", "Claims", List.of(
                new LogicalEntity("e-claim", "Claim", List.of(
                        LogicalAttribute.named("Claim_ID"), LogicalAttribute.named("foo"))),
                new LogicalEntity("e-widget", "Widget", List.of(LogicalAttribute.named("bar")))
        ));
    }

    @Test
    @DisplayName("Should split names into overlaps, collisions and gaps")
    void testReport() {
        when(domainDirectory.findById("d-1")).thenReturn(Optional.of(domain));

        OntologyCoverageReport report = analyzer.analyzeDomain("d-1");

        assertEquals("d-1", report.domainId());
        assertEquals("Claims", report.domainName());
        assertEquals(List.of("claim"), report.entityOverlaps());
        assertEquals(List.of("Widget"), report.entityCollisions());
        assertEquals(List.of("authorization", "beneficiary", "claim_line", "provider", "remittance", "scheme"),
                report.uncoveredEntities());
        assertEquals(List.of("claim_id"), report.attributeOverlaps());
        assertEquals(List.of("bar", "foo"), report.attributeCollisions());
        assertTrue(report.uncoveredAttributes().contains("claim_date"));
        assertFalse(report.uncoveredAttributes().contains("claim_id"));
    }

    @Test
    @DisplayName("Should not consult synonyms")
    void testExactNamesOnly() {
        Domain synonyms = new Domain("d-2", "Members", List.of(
                new LogicalEntity("e-member", "Member", List.of(LogicalAttribute.named("dob")))));

        OntologyCoverageReport report = analyzer.analyze(synonyms);

        assertTrue(report.entityOverlaps().isEmpty());
        assertEquals(List.of("Member"), report.entityCollisions());
        assertTrue(report.uncoveredAttributes().contains("date_of_birth"));
    }

    @Test
    @DisplayName("Should throw NotFoundException for unknown domains")
    void testUnknownDomain() {
        when(domainDirectory.findById("missing")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> analyzer.analyzeDomain("missing"));
    }
}
