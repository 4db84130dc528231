package com.datamodel.matching.similarity;

import com.datamodel.matching.core.model.ColumnStatistics;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Scores how well profiling statistics support a column as a mapping target.
 *
 * <p>Completeness contributes up to 0.6 (null ratio at most 0.05, 0.2 or 0.35).
 * Uniqueness contributes up to 0.4 for id-like columns (distinct/total at least
 * 0.9 or 0.5) and up to 0.2 for other columns that look categorical (at most 0.1
 * or 0.5). The sum is capped at 1.0. Unknown statistics contribute nothing.</p>
 */
public class ColumnEvidenceScorer {

    static final String[] NULL_RATIO_KEYS = {"null_pct", "null_ratio", "pct_null"};
    static final String[] NULL_COUNT_KEYS = {"nulls", "null_count"};
    static final String[] TOTAL_KEYS = {"total", "count", "row_count"};
    static final String[] DISTINCT_KEYS = {"distinct_count", "distinct", "approx_distinct"};

    public double score(String columnName, ColumnStatistics stats) {
        if (stats == null || stats.isEmpty()) {
            return 0.0;
        }

        String column = columnName != null ? columnName.toLowerCase(Locale.ROOT) : "";
        double score = completeness(stats) + uniqueness(column, stats);
        return Math.min(score, 1.0);
    }

    /**
     * Null ratio from an explicit ratio key, else from raw null and row counts.
     */
    OptionalDouble nullRatio(ColumnStatistics stats) {
        OptionalDouble ratio = stats.firstNumber(NULL_RATIO_KEYS);
        if (ratio.isPresent()) {
            return ratio;
        }
        OptionalDouble total = stats.firstNumber(TOTAL_KEYS);
        OptionalDouble nulls = stats.firstNumber(NULL_COUNT_KEYS);
        if (total.isPresent() && nulls.isPresent() && total.getAsDouble() > 0) {
            return OptionalDouble.of(nulls.getAsDouble() / total.getAsDouble());
        }
        return OptionalDouble.empty();
    }

    private double completeness(ColumnStatistics stats) {
        OptionalDouble ratio = nullRatio(stats);
        if (ratio.isEmpty()) {
            return 0.0;
        }
        double nullRatio = ratio.getAsDouble();
        if (nullRatio <= 0.05) {
            return 0.6;
        }
        if (nullRatio <= 0.2) {
            return 0.4;
        }
        if (nullRatio <= 0.35) {
            return 0.2;
        }
        return 0.0;
    }

    private double uniqueness(String column, ColumnStatistics stats) {
        OptionalDouble distinct = stats.firstNumber(DISTINCT_KEYS);
        OptionalDouble total = stats.firstNumber(TOTAL_KEYS);
        if (distinct.isEmpty() || total.isEmpty() || total.getAsDouble() <= 0) {
            return 0.0;
        }

        double uniqueness = distinct.getAsDouble() / total.getAsDouble();
        if (column.contains("id")) {
            if (uniqueness >= 0.9) {
                return 0.4;
            }
            if (uniqueness >= 0.5) {
                return 0.2;
            }
            return 0.0;
        }
        if (uniqueness <= 0.1) {
            return 0.2;
        }
        if (uniqueness <= 0.5) {
            return 0.1;
        }
        return 0.0;
    }
}
