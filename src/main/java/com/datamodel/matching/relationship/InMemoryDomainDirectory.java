package com.datamodel.matching.relationship;

import com.datamodel.matching.core.model.Domain;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link DomainDirectory}.
 */
public class InMemoryDomainDirectory implements DomainDirectory {

    private final ConcurrentMap<String, Domain> domains = new ConcurrentHashMap<>();

    public InMemoryDomainDirectory register(Domain domain) {
        domains.put(domain.id(), domain);
        return this;
    }

    @Override
    public Optional<Domain> findById(String domainId) {
        if (domainId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(domains.get(domainId));
    }
}
