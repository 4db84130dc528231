package com.datamodel.matching.relationship;

import java.util.List;
import java.util.Objects;

/**
 * Profiling summary of one source, as consumed by relationship inference.
 *
 * @param name        source name; matched to an entity of the same name
 * @param rowCount    source row count, never negative
 * @param foreignKeys foreign-key matches found in the source
 */
public record SourceProfile(String name, long rowCount, List<ForeignKeyHint> foreignKeys) {

    public SourceProfile {
        name = name != null ? name.trim() : "";
        rowCount = Math.max(rowCount, 0);
        foreignKeys = foreignKeys != null ? foreignKeys.stream().filter(Objects::nonNull).toList() : List.of();
    }
}
