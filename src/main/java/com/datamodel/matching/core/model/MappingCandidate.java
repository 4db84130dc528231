package com.datamodel.matching.core.model;

import java.util.Objects;

/**
 * A proposed physical column for a logical attribute.
 *
 * @param sourceTableId id of the table the column belongs to, may be null
 * @param columnName    bare column name
 * @param columnPath    {@code <table>.<column>}, or the bare column name for unnamed tables
 * @param confidence    blended confidence in (0, 1]
 * @param rationale     human-readable explanation of the score
 * @param scores        per-signal breakdown
 */
public record MappingCandidate(
        String sourceTableId,
        String columnName,
        String columnPath,
        double confidence,
        String rationale,
        ComponentScores scores
) {
    public MappingCandidate {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        Objects.requireNonNull(columnPath, "columnPath is required");
        Objects.requireNonNull(scores, "scores is required");
    }
}
