package com.datamodel.matching.core.model;

import java.util.List;

/**
 * Ontology concept the model does not cover.
 *
 * @param canonicalEntity   canonical ontology entity name
 * @param missingAttributes preferred attributes absent from the model
 * @param reason            always {@link #ONTOLOGY_GAP}
 */
public record CoverageGap(String canonicalEntity, List<String> missingAttributes, String reason) {

    public static final String ONTOLOGY_GAP = "ontology_gap";

    public CoverageGap {
        missingAttributes = missingAttributes != null ? List.copyOf(missingAttributes) : List.of();
        reason = reason != null ? reason : ONTOLOGY_GAP;
    }

    public CoverageGap(String canonicalEntity, List<String> missingAttributes) {
        this(canonicalEntity, missingAttributes, ONTOLOGY_GAP);
    }
}
