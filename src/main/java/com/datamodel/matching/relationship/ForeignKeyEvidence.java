package com.datamodel.matching.relationship;

/**
 * Evidence stored on a relationship row after inference.
 *
 * @param source       child source name
 * @param column       child key column
 * @param target       referenced source name
 * @param targetColumn referenced key column
 * @param rowCount     child row count
 * @param matchCount   child rows with a matching parent
 * @param coverage     {@code min(matchCount / rowCount, 1)} rounded to 6 decimals, 0 without rows
 */
public record ForeignKeyEvidence(
        String source,
        String column,
        String target,
        String targetColumn,
        long rowCount,
        long matchCount,
        double coverage
) {
    /**
     * Builds evidence for a foreign-key hint of the given source.
     */
    public static ForeignKeyEvidence from(String source, long rowCount, ForeignKeyHint hint) {
        double coverage = 0.0;
        if (rowCount > 0) {
            double ratio = Math.min((double) hint.matchCount() / rowCount, 1.0);
            coverage = Math.round(ratio * 1_000_000d) / 1_000_000d;
        }
        return new ForeignKeyEvidence(
                source,
                hint.column(),
                hint.referencedSource(),
                hint.referencedColumn(),
                rowCount,
                hint.matchCount(),
                coverage
        );
    }
}
