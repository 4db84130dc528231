package com.datamodel.matching.ontology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical entity of the reference ontology.
 *
 * @param canonicalName       canonical key, lowercase
 * @param synonyms            alternative entity names, in declaration order
 * @param preferredAttributes canonical attribute name to its synonyms, in declaration order
 */
public record OntologyEntity(String canonicalName, Set<String> synonyms,
                             Map<String, List<String>> preferredAttributes) {

    public OntologyEntity {
        Objects.requireNonNull(canonicalName, "canonicalName is required");
        synonyms = synonyms != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(synonyms))
                : Set.of();
        if (preferredAttributes != null) {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            preferredAttributes.forEach((name, aliases) ->
                    copy.put(name, aliases != null ? List.copyOf(aliases) : List.of()));
            preferredAttributes = Collections.unmodifiableMap(copy);
        } else {
            preferredAttributes = Map.of();
        }
    }

    /**
     * Canonical attribute names in declaration order.
     */
    public List<String> preferredAttributeNames() {
        return List.copyOf(preferredAttributes.keySet());
    }
}
