package com.datamodel.matching.relationship;

import com.datamodel.matching.core.model.ColumnStatistics;
import com.datamodel.matching.core.model.FkEvidence;

import java.util.OptionalDouble;

/**
 * Computes coverage and fan-out evidence for a proposed foreign key from the
 * profiling statistics of the child key column and the parent key column.
 *
 * <ul>
 *   <li>coverage = 1 - null ratio of the child column; ratios above 1 are read as
 *       percentages (values above 100 saturate), result clamped to [0, 1]</li>
 *   <li>child per parent mean = child row count / parent distinct count, when the
 *       parent count is positive and the result finite</li>
 * </ul>
 */
public class RelationshipEvidenceCalculator {

    static final String[] NULL_RATIO_KEYS = {"null_pct", "null_percent", "null_ratio"};
    static final String[] CHILD_ROW_KEYS = {"row_count", "count", "non_null_count"};
    static final String[] PARENT_DISTINCT_KEYS = {"distinct_count", "distinct", "unique_count"};

    public FkEvidence evidenceForFk(ColumnStatistics childStats, ColumnStatistics parentStats) {
        ColumnStatistics child = childStats != null ? childStats : ColumnStatistics.empty();
        ColumnStatistics parent = parentStats != null ? parentStats : ColumnStatistics.empty();
        return new FkEvidence(coverage(child), childPerParentMean(child, parent));
    }

    private Double coverage(ColumnStatistics child) {
        OptionalDouble raw = child.firstNumber(NULL_RATIO_KEYS);
        if (raw.isEmpty()) {
            return null;
        }
        double nullRatio = raw.getAsDouble();
        if (nullRatio > 1) {
            nullRatio = nullRatio <= 100 ? nullRatio / 100 : 1.0;
        }
        nullRatio = Math.max(0.0, Math.min(nullRatio, 1.0));
        return 1.0 - nullRatio;
    }

    private Double childPerParentMean(ColumnStatistics child, ColumnStatistics parent) {
        OptionalDouble childRows = child.firstNumber(CHILD_ROW_KEYS);
        OptionalDouble parentDistinct = parent.firstNumber(PARENT_DISTINCT_KEYS);
        if (childRows.isEmpty() || parentDistinct.isEmpty() || parentDistinct.getAsDouble() <= 0) {
            return null;
        }
        double mean = childRows.getAsDouble() / parentDistinct.getAsDouble();
        return Double.isFinite(mean) ? mean : null;
    }
}
