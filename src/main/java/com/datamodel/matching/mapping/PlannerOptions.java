package com.datamodel.matching.mapping;

/**
 * Configuration for the mapping planner.
 *
 * @param maxCandidates maximum candidates returned per attribute
 */
public record PlannerOptions(int maxCandidates) {

    public static final int DEFAULT_MAX_CANDIDATES = 3;

    public PlannerOptions {
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("maxCandidates must be > 0");
        }
    }

    /**
     * Default planner configuration: top 3 candidates per attribute.
     */
    public static PlannerOptions defaults() {
        return new PlannerOptions(DEFAULT_MAX_CANDIDATES);
    }
}
