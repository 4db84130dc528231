package com.datamodel.matching.mapping;

import com.datamodel.matching.core.model.AttributeMappingPlan;

import java.util.List;

/**
 * Outcome of planning an entity and saving the winning candidates as drafts.
 *
 * @param plans        full planner output, one entry per attribute
 * @param drafts       draft rows written by this run, in attribute order
 * @param createdCount how many of {@code drafts} were newly created rather than refreshed
 */
public record DraftPlanResult(List<AttributeMappingPlan> plans, List<DraftMapping> drafts, int createdCount) {

    public DraftPlanResult {
        plans = List.copyOf(plans);
        drafts = List.copyOf(drafts);
    }

    public int updatedCount() {
        return drafts.size() - createdCount;
    }
}
