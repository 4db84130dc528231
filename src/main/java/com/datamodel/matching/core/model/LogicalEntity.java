package com.datamodel.matching.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Logical entity of a drafted model.
 *
 * @param id         entity identity, may be null in model drafts
 * @param name       entity name as modeled
 * @param attributes attributes in declaration order
 */
public record LogicalEntity(String id, String name, List<LogicalAttribute> attributes) {

    public LogicalEntity {
        name = name != null ? name : "";
        attributes = attributes != null ? attributes.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public List<String> attributeNames() {
        return attributes.stream().map(LogicalAttribute::name).toList();
    }
}
