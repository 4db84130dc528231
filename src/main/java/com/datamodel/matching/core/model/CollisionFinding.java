package com.datamodel.matching.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Two attributes on different entities whose names are near-duplicates.
 *
 * @param entityA   entity of the first attribute in scan order
 * @param entityB   entity of the second attribute in scan order
 * @param attribute representative name (the shorter of the two)
 * @param scores    similarity per attribute pair, keyed {@code A.attr~B.attr}
 */
public record CollisionFinding(String entityA, String entityB, String attribute, Map<String, Double> scores) {

    public CollisionFinding {
        scores = scores != null ? Collections.unmodifiableMap(new LinkedHashMap<>(scores)) : Map.of();
    }
}
