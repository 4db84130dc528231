package com.datamodel.matching.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link MappingRepository}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryMappingRepository implements MappingRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMappingRepository.class);

    private final ConcurrentMap<String, DraftMapping> mappings = new ConcurrentHashMap<>();

    @Override
    public DraftMapping save(DraftMapping mapping) {
        mappings.put(mapping.getId(), mapping);
        log.debug("Saved mapping {} (attribute={}, column={}, status={})",
                mapping.getId(), mapping.getAttributeId(), mapping.getColumnPath(), mapping.getStatus());
        return mapping;
    }

    @Override
    public Optional<DraftMapping> findById(String mappingId) {
        return Optional.ofNullable(mappings.get(mappingId));
    }

    @Override
    public Optional<DraftMapping> findDraftByAttribute(String attributeId) {
        return mappings.values().stream()
                .filter(DraftMapping::isDraft)
                .filter(m -> Objects.equals(attributeId, m.getAttributeId()))
                .min(Comparator.comparing(DraftMapping::getCreatedAt));
    }

    @Override
    public List<DraftMapping> findByAttribute(String attributeId) {
        return mappings.values().stream()
                .filter(m -> Objects.equals(attributeId, m.getAttributeId()))
                .sorted(Comparator.comparing(DraftMapping::getCreatedAt))
                .toList();
    }

    @Override
    public List<DraftMapping> findByEntity(String entityId) {
        return mappings.values().stream()
                .filter(m -> Objects.equals(entityId, m.getEntityId()))
                .sorted(Comparator.comparing(DraftMapping::getCreatedAt))
                .toList();
    }
}
