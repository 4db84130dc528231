package com.datamodel.matching.similarity;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical datatype families used for compatibility scoring.
 */
public enum DatatypeBucket {
    STRING(Set.of("string", "varchar", "char", "text", "nvarchar", "character varying")),
    INT(Set.of("int", "integer", "bigint", "smallint", "number")),
    DECIMAL(Set.of("decimal", "numeric", "float", "double", "real")),
    DATE(Set.of("date", "datetime", "timestamp", "timestamptz"));

    private final Set<String> aliases;

    DatatypeBucket(Set<String> aliases) {
        this.aliases = aliases;
    }

    public Set<String> aliases() {
        return aliases;
    }

    /**
     * Resolves a datatype string (already or not yet normalized) to its bucket.
     */
    public static Optional<DatatypeBucket> fromAlias(String datatype) {
        if (datatype == null) {
            return Optional.empty();
        }
        String normalized = datatype.trim().toLowerCase(Locale.ROOT);
        for (DatatypeBucket bucket : values()) {
            if (bucket.aliases.contains(normalized)) {
                return Optional.of(bucket);
            }
        }
        return Optional.empty();
    }
}
