package com.datamodel.matching.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A drafted logical model: entities in declaration order.
 */
public record LogicalModel(List<LogicalEntity> entities) {

    public LogicalModel {
        entities = entities != null ? entities.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public static LogicalModel of(LogicalEntity... entities) {
        return new LogicalModel(List.of(entities));
    }
}
