package com.datamodel.matching.ontology;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable reference ontology: canonical entities with synonyms and preferred
 * attributes, plus semantic alias keyword groups.
 *
 * <p>Built once (usually by {@link OntologyLoader}) and shared read-only by the
 * planner and analyzers.</p>
 */
public final class Ontology {

    private final Map<String, OntologyEntity> entities;
    private final Map<String, List<String>> semanticAliases;

    public Ontology(Collection<OntologyEntity> entities, Map<String, List<String>> semanticAliases) {
        Map<String, OntologyEntity> byName = new LinkedHashMap<>();
        for (OntologyEntity entity : entities) {
            byName.putIfAbsent(normalize(entity.canonicalName()), entity);
        }
        this.entities = Collections.unmodifiableMap(byName);

        Map<String, List<String>> aliases = new LinkedHashMap<>();
        if (semanticAliases != null) {
            semanticAliases.forEach((key, values) ->
                    aliases.put(key, values != null ? List.copyOf(values) : List.of()));
        }
        this.semanticAliases = Collections.unmodifiableMap(aliases);
    }

    /**
     * Maps an entity name or synonym to its canonical key. Names the ontology does
     * not know are returned trimmed and lowercased.
     */
    public String canonicalEntityName(String name) {
        String candidate = normalize(name);
        for (Map.Entry<String, OntologyEntity> entry : entities.entrySet()) {
            if (candidate.equals(entry.getKey())) {
                return entry.getKey();
            }
            for (String synonym : entry.getValue().synonyms()) {
                if (candidate.equals(normalize(synonym))) {
                    return entry.getKey();
                }
            }
        }
        return candidate;
    }

    /**
     * Returns the canonical attribute name when {@code attributeName} is the canonical
     * name itself or one of its synonyms within the given canonical entity.
     */
    public Optional<String> suggestPreferredAttribute(String canonicalEntity, String attributeName) {
        if (attributeName == null || attributeName.isBlank()) {
            return Optional.empty();
        }
        OntologyEntity entity = entities.get(normalize(canonicalEntity));
        if (entity == null) {
            return Optional.empty();
        }

        String candidate = normalize(attributeName);
        for (Map.Entry<String, List<String>> preferred : entity.preferredAttributes().entrySet()) {
            if (candidate.equals(normalize(preferred.getKey()))) {
                return Optional.of(preferred.getKey());
            }
            for (String alias : preferred.getValue()) {
                if (candidate.equals(normalize(alias))) {
                    return Optional.of(preferred.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public Optional<OntologyEntity> entity(String canonicalName) {
        return Optional.ofNullable(entities.get(normalize(canonicalName)));
    }

    /**
     * Whether {@code name} (or a synonym of it) is an ontology entity.
     */
    public boolean isKnownEntity(String name) {
        return entities.containsKey(canonicalEntityName(name));
    }

    /**
     * Entities in declaration order.
     */
    public Collection<OntologyEntity> entities() {
        return entities.values();
    }

    public Map<String, List<String>> semanticAliases() {
        return semanticAliases;
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "Ontology{entities=" + entities.keySet() + ", semanticAliases=" + semanticAliases.keySet() + '}';
    }
}
