package com.datamodel.matching.core.model;

import java.util.List;

/**
 * Result of a MECE analysis over a drafted model.
 */
public record MeceReport(
        List<CollisionFinding> collisions,
        List<CoverageGap> uncoveredTerms,
        List<NamingSuggestion> namingSuggestions,
        double meceScore
) {
    public MeceReport {
        collisions = collisions != null ? List.copyOf(collisions) : List.of();
        uncoveredTerms = uncoveredTerms != null ? List.copyOf(uncoveredTerms) : List.of();
        namingSuggestions = namingSuggestions != null ? List.copyOf(namingSuggestions) : List.of();
        if (meceScore < 0.0 || meceScore > 1.0) {
            throw new IllegalArgumentException("MECE score must be between 0.0 and 1.0");
        }
    }
}
