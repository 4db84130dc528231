package com.datamodel.matching.mapping;

import java.util.List;
import java.util.Optional;

/**
 * Storage for attribute-to-column mappings.
 * Implementations own their transaction boundary; each save is one aggregate.
 */
public interface MappingRepository {

    /**
     * Saves a new mapping or replaces the stored one with the same id.
     */
    DraftMapping save(DraftMapping mapping);

    /**
     * Finds a mapping by id.
     */
    Optional<DraftMapping> findById(String mappingId);

    /**
     * Finds the draft mapping of an attribute, if one exists.
     */
    Optional<DraftMapping> findDraftByAttribute(String attributeId);

    /**
     * Lists all mappings (any status) of an attribute.
     */
    List<DraftMapping> findByAttribute(String attributeId);

    /**
     * Lists all mappings of an entity.
     */
    List<DraftMapping> findByEntity(String entityId);
}
