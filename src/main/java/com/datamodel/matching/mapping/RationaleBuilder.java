package com.datamodel.matching.mapping;

import com.datamodel.matching.core.model.ComponentScores;

import java.util.ArrayList;
import java.util.List;

/**
 * Explains a candidate's score from threshold bands on each signal.
 */
public class RationaleBuilder {

    public String build(String columnName, ComponentScores scores) {
        List<String> reasons = new ArrayList<>();

        if (scores.name() >= 0.85) {
            reasons.add("strong name match");
        } else if (scores.name() >= 0.6) {
            reasons.add("partial name similarity");
        }

        if (scores.dtype() >= 0.85) {
            reasons.add("compatible data type");
        } else if (scores.dtype() >= 0.25) {
            reasons.add("loosely compatible type");
        }

        if (scores.semantic() >= 0.75) {
            reasons.add("semantic keyword alignment");
        } else if (scores.semantic() >= 0.5) {
            reasons.add("possible semantic hint");
        }

        if (scores.evidence() >= 0.5) {
            reasons.add("good profiling coverage");
        } else if (scores.evidence() >= 0.25) {
            reasons.add("some statistical support");
        }

        if (reasons.isEmpty()) {
            reasons.add("column " + columnName + " has limited supporting evidence");
        }
        return String.join(", ", reasons);
    }
}
