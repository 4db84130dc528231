package com.datamodel.matching.relationship;

import com.datamodel.matching.core.model.Cardinality;
import com.datamodel.matching.core.model.ColumnStatistics;
import com.datamodel.matching.core.model.FkEvidence;
import com.datamodel.matching.core.model.LogicalEntity;
import com.datamodel.matching.core.model.PhysicalColumn;
import com.datamodel.matching.core.model.PhysicalTable;
import com.datamodel.matching.core.model.RelationshipProposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Attaches deterministic evidence to relationship proposals and lets the evidence
 * decide the cardinality.
 *
 * <p>Entities are matched to proposals by name (case-insensitive) and to profiled
 * tables by normalized identifier. The key column of each side is guessed from the
 * entity's attribute names. When the classifier reaches a verdict it replaces the
 * proposed type; an undetermined verdict keeps the proposed type.</p>
 */
public class RelationshipEnricher {
    private static final Logger log = LoggerFactory.getLogger(RelationshipEnricher.class);

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+", Pattern.CASE_INSENSITIVE);

    private final RelationshipEvidenceCalculator evidenceCalculator;
    private final CardinalityClassifier cardinalityClassifier;
    private final KeyNameGuesser keyNameGuesser;

    public RelationshipEnricher() {
        this(new RelationshipEvidenceCalculator(), new CardinalityClassifier(), new KeyNameGuesser());
    }

    public RelationshipEnricher(RelationshipEvidenceCalculator evidenceCalculator,
                                CardinalityClassifier cardinalityClassifier,
                                KeyNameGuesser keyNameGuesser) {
        this.evidenceCalculator = evidenceCalculator;
        this.cardinalityClassifier = cardinalityClassifier;
        this.keyNameGuesser = keyNameGuesser;
    }

    /**
     * Returns the proposals, in order, with evidence attached and types resolved.
     */
    public List<RelationshipProposal> enrich(List<RelationshipProposal> proposals,
                                             List<LogicalEntity> entities,
                                             List<PhysicalTable> tables) {
        if (proposals == null || proposals.isEmpty()) {
            return List.of();
        }

        Map<String, LogicalEntity> entityLookup = new HashMap<>();
        if (entities != null) {
            for (LogicalEntity entity : entities) {
                if (entity != null && !entity.name().isBlank()) {
                    entityLookup.putIfAbsent(entity.name().trim().toLowerCase(Locale.ROOT), entity);
                }
            }
        }
        Map<String, PhysicalTable> tableLookup = buildTableLookup(tables);

        List<RelationshipProposal> results = new ArrayList<>(proposals.size());
        for (RelationshipProposal proposal : proposals) {
            if (proposal == null) {
                continue;
            }
            FkEvidence evidence = evidenceFor(proposal, entityLookup, tableLookup);
            Cardinality cardinality = cardinalityClassifier.classify(evidence.childPerParentMean());
            String resolvedType = cardinality.isDetermined() ? cardinality.wireValue() : proposal.type();

            log.debug("Relationship {} -> {}: evidence={} proposedType={} resolvedType={}",
                    proposal.fromEntity(), proposal.toEntity(), evidence, proposal.type(), resolvedType);
            results.add(proposal.withEvidence(resolvedType, evidence));
        }

        log.info("relationship.enriched proposals={}", results.size());
        return results;
    }

    private FkEvidence evidenceFor(RelationshipProposal proposal,
                                   Map<String, LogicalEntity> entityLookup,
                                   Map<String, PhysicalTable> tableLookup) {
        LogicalEntity from = entityLookup.get(proposal.fromEntity().toLowerCase(Locale.ROOT));
        LogicalEntity to = entityLookup.get(proposal.toEntity().toLowerCase(Locale.ROOT));
        if (from == null || to == null) {
            return FkEvidence.none();
        }

        Optional<String> childKey = keyNameGuesser.guess(from.attributeNames());
        Optional<String> parentKey = keyNameGuesser.guess(to.attributeNames());
        if (childKey.isEmpty() || parentKey.isEmpty()) {
            return FkEvidence.none();
        }

        ColumnStatistics childStats = null;
        ColumnStatistics parentStats = null;

        PhysicalTable fromTable = tableLookup.get(normalizeIdentifier(from.name()));
        if (fromTable != null) {
            childStats = columnStats(fromTable, childKey.get())
                    .withDefault("row_count", fromTable.rowCount());
        }
        PhysicalTable toTable = tableLookup.get(normalizeIdentifier(to.name()));
        if (toTable != null) {
            parentStats = columnStats(toTable, parentKey.get());
        }
        return evidenceCalculator.evidenceForFk(childStats, parentStats);
    }

    private static ColumnStatistics columnStats(PhysicalTable table, String columnName) {
        return table.column(columnName)
                .map(PhysicalColumn::statistics)
                .orElse(ColumnStatistics.empty());
    }

    private static Map<String, PhysicalTable> buildTableLookup(List<PhysicalTable> tables) {
        Map<String, PhysicalTable> lookup = new HashMap<>();
        if (tables == null) {
            return lookup;
        }
        for (PhysicalTable table : tables) {
            if (table == null) {
                continue;
            }
            for (String candidate : List.of(normalizeIdentifier(table.tableName()),
                    normalizeIdentifier(table.qualifiedName()))) {
                if (!candidate.isEmpty()) {
                    lookup.putIfAbsent(candidate, table);
                }
            }
        }
        return lookup;
    }

    /**
     * Normalizes an identifier to lower snake case: {@code "ClaimLine"} and
     * {@code "claim-line"} both become {@code "claim_line"}.
     */
    static String normalizeIdentifier(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String snake = CAMEL_BOUNDARY.matcher(value).replaceAll("$1_$2");
        String canonical = NON_ALPHANUMERIC.matcher(snake).replaceAll("_");
        int start = 0;
        int end = canonical.length();
        while (start < end && canonical.charAt(start) == '_') {
            start++;
        }
        while (end > start && canonical.charAt(end - 1) == '_') {
            end--;
        }
        return canonical.substring(start, end).toLowerCase(Locale.ROOT);
    }
}
