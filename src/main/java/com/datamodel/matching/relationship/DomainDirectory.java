package com.datamodel.matching.relationship;

import com.datamodel.matching.core.model.Domain;

import java.util.Optional;

/**
 * Resolves domains and their logical entities from the model-authoring layer.
 */
public interface DomainDirectory {

    /**
     * Finds a domain by id.
     *
     * @param domainId the domain id
     * @return the domain, or empty if it does not exist
     */
    Optional<Domain> findById(String domainId);
}
