package com.datamodel.matching.relationship;

/**
 * A foreign-key match reported by profiling for one source column.
 *
 * @param column           child column name
 * @param referencedSource name of the referenced source
 * @param referencedColumn referenced column, {@code id} when not reported
 * @param matchCount       child rows whose key matched a parent row
 * @param relationshipType explicit relationship type, may be null
 * @param description      optional description
 */
public record ForeignKeyHint(
        String column,
        String referencedSource,
        String referencedColumn,
        long matchCount,
        String relationshipType,
        String description
) {
    public ForeignKeyHint {
        column = column != null ? column.trim() : "";
        referencedSource = referencedSource != null ? referencedSource.trim() : "";
        referencedColumn = referencedColumn != null && !referencedColumn.isBlank() ? referencedColumn.trim() : "id";
        matchCount = Math.max(matchCount, 0);
    }
}
