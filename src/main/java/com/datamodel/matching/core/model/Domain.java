package com.datamodel.matching.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A modeling domain and the logical entities it owns.
 */
public record Domain(String id, String name, List<LogicalEntity> entities) {

    public Domain {
        Objects.requireNonNull(id, "id is required");
        name = name != null ? name : "";
        entities = entities != null ? entities.stream().filter(Objects::nonNull).toList() : List.of();
    }

    /**
     * Finds an entity by name, ignoring case and surrounding whitespace.
     */
    public Optional<LogicalEntity> entityNamed(String entityName) {
        if (entityName == null || entityName.isBlank()) {
            return Optional.empty();
        }
        String wanted = entityName.trim();
        return entities.stream()
                .filter(e -> e.name().trim().equalsIgnoreCase(wanted))
                .findFirst();
    }
}
