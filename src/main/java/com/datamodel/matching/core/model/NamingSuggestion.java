package com.datamodel.matching.core.model;

/**
 * Suggested rename of a modeled attribute to its canonical ontology name.
 */
public record NamingSuggestion(String entity, String from, String to) {
}
