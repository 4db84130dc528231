package com.datamodel.matching.coverage;

import java.util.List;

/**
 * Name-level comparison of a domain against the ontology vocabulary.
 * Every list is sorted.
 *
 * @param domainId            analyzed domain
 * @param domainName          analyzed domain name
 * @param entityOverlaps      ontology entity names the domain models
 * @param attributeOverlaps   ontology attribute names the domain models
 * @param entityCollisions    modeled entity names the ontology does not know
 * @param attributeCollisions modeled attribute names the ontology does not know
 * @param uncoveredEntities   ontology entity names the domain does not model
 * @param uncoveredAttributes ontology attribute names the domain does not model
 */
public record OntologyCoverageReport(
        String domainId,
        String domainName,
        List<String> entityOverlaps,
        List<String> attributeOverlaps,
        List<String> entityCollisions,
        List<String> attributeCollisions,
        List<String> uncoveredEntities,
        List<String> uncoveredAttributes
) {
    public OntologyCoverageReport {
        entityOverlaps = List.copyOf(entityOverlaps);
        attributeOverlaps = List.copyOf(attributeOverlaps);
        entityCollisions = List.copyOf(entityCollisions);
        attributeCollisions = List.copyOf(attributeCollisions);
        uncoveredEntities = List.copyOf(uncoveredEntities);
        uncoveredAttributes = List.copyOf(uncoveredAttributes);
    }
}
