package com.datamodel.matching.coverage;

import com.datamodel.matching.core.model.Domain;
import com.datamodel.matching.core.model.LogicalAttribute;
import com.datamodel.matching.core.model.LogicalEntity;
import com.datamodel.matching.exception.NotFoundException;
import com.datamodel.matching.ontology.Ontology;
import com.datamodel.matching.ontology.OntologyEntity;
import com.datamodel.matching.relationship.DomainDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares the entity and attribute names of a domain with the ontology's canonical
 * vocabulary by exact (trimmed, case-insensitive) name. Synonyms are not consulted;
 * {@link MeceAnalyzer} does the synonym-aware analysis.
 */
public class OntologyCoverageAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(OntologyCoverageAnalyzer.class);

    private final Ontology ontology;
    private final DomainDirectory domainDirectory;

    public OntologyCoverageAnalyzer(Ontology ontology, DomainDirectory domainDirectory) {
        this.ontology = ontology;
        this.domainDirectory = domainDirectory;
    }

    /**
     * Analyzes the domain with the given id.
     *
     * @throws NotFoundException if the domain does not exist
     */
    public OntologyCoverageReport analyzeDomain(String domainId) {
        Domain domain = domainDirectory.findById(domainId)
                .orElseThrow(() -> new NotFoundException("Domain", domainId));
        return analyze(domain);
    }

    public OntologyCoverageReport analyze(Domain domain) {
        Map<String, String> domainEntities = normalizedMap(
                domain.entities().stream().map(LogicalEntity::name).toList());
        Map<String, String> domainAttributes = normalizedMap(domain.entities().stream()
                .flatMap(e -> e.attributes().stream())
                .map(LogicalAttribute::name)
                .toList());

        Map<String, String> ontologyEntities = normalizedMap(ontology.entities().stream()
                .map(OntologyEntity::canonicalName)
                .toList());
        Map<String, String> ontologyAttributes = normalizedMap(ontology.entities().stream()
                .flatMap(e -> e.preferredAttributeNames().stream())
                .toList());

        OntologyCoverageReport report = new OntologyCoverageReport(
                domain.id(),
                domain.name(),
                overlaps(domainEntities, ontologyEntities),
                overlaps(domainAttributes, ontologyAttributes),
                collisions(domainEntities, ontologyEntities),
                collisions(domainAttributes, ontologyAttributes),
                gaps(domainEntities, ontologyEntities),
                gaps(domainAttributes, ontologyAttributes)
        );
        log.info("ontology.coverage domainId={} entityOverlaps={} uncoveredEntities={} uncoveredAttributes={}",
                domain.id(), report.entityOverlaps().size(), report.uncoveredEntities().size(),
                report.uncoveredAttributes().size());
        return report;
    }

    private static List<String> overlaps(Map<String, String> domainNames, Map<String, String> ontologyNames) {
        return ontologyNames.entrySet().stream()
                .filter(e -> domainNames.containsKey(e.getKey()))
                .map(Map.Entry::getValue)
                .distinct()
                .sorted()
                .toList();
    }

    private static List<String> collisions(Map<String, String> domainNames, Map<String, String> ontologyNames) {
        return domainNames.entrySet().stream()
                .filter(e -> !ontologyNames.containsKey(e.getKey()))
                .map(Map.Entry::getValue)
                .distinct()
                .sorted()
                .toList();
    }

    private static List<String> gaps(Map<String, String> domainNames, Map<String, String> ontologyNames) {
        return ontologyNames.entrySet().stream()
                .filter(e -> !domainNames.containsKey(e.getKey()))
                .map(Map.Entry::getValue)
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Maps normalized name to the last original spelling seen.
     */
    private static Map<String, String> normalizedMap(Collection<String> names) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String name : names) {
            if (name != null && !name.isBlank()) {
                map.put(name.trim().toLowerCase(Locale.ROOT), name.trim());
            }
        }
        return map;
    }
}
