package com.datamodel.matching.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Ranked mapping candidates for one logical attribute, best first.
 */
public record AttributeMappingPlan(String attributeId, String attributeName, List<MappingCandidate> candidates) {

    public AttributeMappingPlan {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public Optional<MappingCandidate> best() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    public boolean hasCandidates() {
        return !candidates.isEmpty();
    }
}
