package com.datamodel.matching.mapping;

import com.datamodel.matching.core.model.AttributeMappingPlan;
import com.datamodel.matching.core.model.LogicalEntity;
import com.datamodel.matching.core.model.MappingCandidate;
import com.datamodel.matching.core.model.PhysicalTable;
import com.datamodel.matching.exception.NotFoundException;
import com.datamodel.matching.metrics.MetricsService;
import com.datamodel.matching.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the planner for an entity and keeps each attribute's best candidate as a draft.
 *
 * <p>Per attribute there is at most one draft row: an existing draft is refreshed in
 * place, otherwise a new one is created. Attributes without an id, without
 * candidates, or whose best candidate has no source table are skipped. Approved
 * and rejected mappings are never modified here.</p>
 */
public class MappingDraftService {
    private static final Logger log = LoggerFactory.getLogger(MappingDraftService.class);

    private final MappingPlanner planner;
    private final MappingRepository repository;
    private final MetricsService metricsService;

    public MappingDraftService(MappingPlanner planner, MappingRepository repository) {
        this(planner, repository, new NoOpMetricsService());
    }

    public MappingDraftService(MappingPlanner planner, MappingRepository repository, MetricsService metricsService) {
        this.planner = planner;
        this.repository = repository;
        this.metricsService = metricsService;
    }

    /**
     * Plans the entity's attributes against {@code tables} and upserts one draft per attribute.
     */
    public DraftPlanResult planAndSaveDrafts(LogicalEntity entity, List<PhysicalTable> tables) {
        List<AttributeMappingPlan> plans = planner.autoplan(entity, tables);
        String entityId = entity != null ? entity.id() : null;

        List<DraftMapping> saved = new ArrayList<>();
        int created = 0;
        for (AttributeMappingPlan plan : plans) {
            if (plan.attributeId() == null || plan.best().isEmpty()) {
                continue;
            }
            MappingCandidate best = plan.best().get();
            if (best.sourceTableId() == null) {
                continue;
            }

            Optional<DraftMapping> existing = repository.findDraftByAttribute(plan.attributeId());
            DraftMapping draft;
            if (existing.isPresent()) {
                draft = existing.get();
                draft.refreshFrom(entityId, best);
                metricsService.incrementDraftMappingSaved(false);
            } else {
                draft = DraftMapping.fromCandidate(entityId, plan.attributeId(), best).build();
                created++;
                metricsService.incrementDraftMappingSaved(true);
            }
            saved.add(repository.save(draft));
        }

        log.info("mapping.drafts.saved entityId={} drafts={} created={}", entityId, saved.size(), created);
        return new DraftPlanResult(plans, saved, created);
    }

    /**
     * Approves a draft mapping.
     *
     * @throws NotFoundException     if the mapping does not exist
     * @throws IllegalStateException if the mapping is not a draft
     */
    public DraftMapping approve(String mappingId) {
        DraftMapping mapping = requireDraft(mappingId);
        mapping.markApproved();
        repository.save(mapping);
        log.info("mapping.approved mappingId={} column={}", mappingId, mapping.getColumnPath());
        return mapping;
    }

    /**
     * Rejects a draft mapping.
     *
     * @throws NotFoundException     if the mapping does not exist
     * @throws IllegalStateException if the mapping is not a draft
     */
    public DraftMapping reject(String mappingId) {
        DraftMapping mapping = requireDraft(mappingId);
        mapping.markRejected();
        repository.save(mapping);
        log.info("mapping.rejected mappingId={} column={}", mappingId, mapping.getColumnPath());
        return mapping;
    }

    private DraftMapping requireDraft(String mappingId) {
        DraftMapping mapping = repository.findById(mappingId)
                .orElseThrow(() -> new NotFoundException("Mapping", mappingId));
        if (!mapping.isDraft()) {
            throw new IllegalStateException("Mapping is not a draft: " + mappingId);
        }
        return mapping;
    }

    public MappingRepository getRepository() {
        return repository;
    }
}
