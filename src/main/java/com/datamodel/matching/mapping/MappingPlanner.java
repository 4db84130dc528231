package com.datamodel.matching.mapping;

import com.datamodel.matching.core.model.AttributeMappingPlan;
import com.datamodel.matching.core.model.LogicalAttribute;
import com.datamodel.matching.core.model.LogicalEntity;
import com.datamodel.matching.core.model.MappingCandidate;
import com.datamodel.matching.core.model.PhysicalColumn;
import com.datamodel.matching.core.model.PhysicalTable;
import com.datamodel.matching.logging.LogContext;
import com.datamodel.matching.metrics.MetricsService;
import com.datamodel.matching.metrics.NoOpMetricsService;
import com.datamodel.matching.similarity.CandidateConfidenceScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Proposes physical source columns for logical attributes.
 *
 * <p>Every column of every table is scored against each attribute. Zero-confidence
 * candidates are dropped, the rest ranked by descending confidence (ties keep scan
 * order: table order, then column declaration order) and trimmed to the configured
 * maximum. Planning is a pure read; persisting the winners is left to
 * {@link MappingDraftService}.</p>
 */
public class MappingPlanner {
    private static final Logger log = LoggerFactory.getLogger(MappingPlanner.class);

    private static final Comparator<MappingCandidate> BY_CONFIDENCE_DESC =
            Comparator.comparingDouble(MappingCandidate::confidence).reversed();

    private final CandidateConfidenceScorer scorer;
    private final RationaleBuilder rationaleBuilder;
    private final PlannerOptions options;
    private final MetricsService metricsService;

    public MappingPlanner() {
        this(new CandidateConfidenceScorer(), PlannerOptions.defaults(), new NoOpMetricsService());
    }

    public MappingPlanner(CandidateConfidenceScorer scorer, PlannerOptions options, MetricsService metricsService) {
        this.scorer = scorer;
        this.rationaleBuilder = new RationaleBuilder();
        this.options = options;
        this.metricsService = metricsService;
    }

    /**
     * Plans mappings for the entity's own attributes.
     */
    public List<AttributeMappingPlan> autoplan(LogicalEntity entity, List<PhysicalTable> tables) {
        return autoplan(entity, entity != null ? entity.attributes() : List.of(), tables);
    }

    /**
     * Plans mappings for the given attributes across all supplied tables.
     *
     * @param entity     the entity being mapped, used for logging only
     * @param attributes attributes to plan; output follows this order
     * @param tables     candidate source tables
     * @return one plan per attribute, each with at most {@link PlannerOptions#maxCandidates()} candidates
     */
    public List<AttributeMappingPlan> autoplan(LogicalEntity entity, List<LogicalAttribute> attributes,
                                               List<PhysicalTable> tables) {
        long start = System.nanoTime();
        String entityName = entity != null ? entity.name() : "";
        List<LogicalAttribute> attributeList = attributes != null ? attributes : List.of();
        List<PhysicalTable> tableList = tables != null ? tables : List.of();

        try (LogContext ignored = LogContext.forPlanning(LogContext.generateCorrelationId(), entityName)) {
            List<AttributeMappingPlan> plans = new ArrayList<>(attributeList.size());
            for (LogicalAttribute attribute : attributeList) {
                if (attribute == null) {
                    continue;
                }
                plans.add(planAttribute(attribute, tableList));
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordPlanningDuration(elapsed);
            log.info("mapping.autoplan entity='{}' attributes={} tables={} durationMs={}",
                    entityName, plans.size(), tableList.size(), elapsed.toMillis());
            return plans;
        }
    }

    private AttributeMappingPlan planAttribute(LogicalAttribute attribute, List<PhysicalTable> tables) {
        List<MappingCandidate> candidates = new ArrayList<>();

        for (PhysicalTable table : tables) {
            if (table == null) {
                continue;
            }
            for (PhysicalColumn column : table.columns()) {
                CandidateConfidenceScorer.CandidateScore score =
                        scorer.score(attribute, column.name(), column.dataType(), column.statistics());
                if (score.confidence() <= 0.0) {
                    continue;
                }
                String rationale = rationaleBuilder.build(column.name(), score.scores());
                candidates.add(new MappingCandidate(
                        table.id(),
                        column.name(),
                        columnPath(table, column),
                        score.confidence(),
                        rationale,
                        score.scores()
                ));
            }
        }

        // List.sort is stable, so equal confidences keep scan order
        candidates.sort(BY_CONFIDENCE_DESC);
        List<MappingCandidate> trimmed = candidates.size() > options.maxCandidates()
                ? List.copyOf(candidates.subList(0, options.maxCandidates()))
                : candidates;

        for (MappingCandidate candidate : trimmed) {
            metricsService.recordCandidateConfidence(candidate.confidence());
        }
        log.debug("Attribute '{}' scored {} candidate columns, kept {}",
                attribute.name(), candidates.size(), trimmed.size());

        return new AttributeMappingPlan(attribute.id(), attribute.name(), trimmed);
    }

    private static String columnPath(PhysicalTable table, PhysicalColumn column) {
        String tableName = table.qualifiedName();
        return tableName.isBlank() ? column.name() : tableName + "." + column.name();
    }

    public PlannerOptions getOptions() {
        return options;
    }
}
