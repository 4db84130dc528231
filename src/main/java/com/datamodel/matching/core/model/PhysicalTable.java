package com.datamodel.matching.core.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Profiled source table. Columns keep their declaration order and are unique by name;
 * a repeated column name keeps its first declaration.
 *
 * @param id            table identity, may be null for ad hoc payloads
 * @param qualifiedName schema-qualified name, e.g. {@code claims.member}
 * @param columns       columns in declaration order
 * @param rowCount      table row count from profiling, null when unknown
 */
public record PhysicalTable(String id, String qualifiedName, List<PhysicalColumn> columns, Long rowCount) {

    public PhysicalTable {
        qualifiedName = qualifiedName != null ? qualifiedName : "";
        columns = uniqueByName(columns);
    }

    public PhysicalTable(String id, String qualifiedName, List<PhysicalColumn> columns) {
        this(id, qualifiedName, columns, null);
    }

    /**
     * Finds a column by name, ignoring case.
     */
    public Optional<PhysicalColumn> column(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return columns.stream()
                .filter(c -> c.name().equalsIgnoreCase(name))
                .findFirst();
    }

    /**
     * Returns the unqualified table name (the part after the last dot).
     */
    public String tableName() {
        int dot = qualifiedName.lastIndexOf('.');
        return dot >= 0 ? qualifiedName.substring(dot + 1) : qualifiedName;
    }

    private static List<PhysicalColumn> uniqueByName(List<PhysicalColumn> columns) {
        if (columns == null || columns.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<PhysicalColumn> unique = new ArrayList<>(columns.size());
        for (PhysicalColumn column : columns) {
            if (column != null && seen.add(column.name())) {
                unique.add(column);
            }
        }
        return List.copyOf(unique);
    }
}
