package com.datamodel.matching.ontology;

/**
 * Runtime exception thrown when an ontology artifact is missing or cannot be parsed.
 */
public class OntologyLoadException extends RuntimeException {

    public OntologyLoadException(String message) {
        super(message);
    }

    public OntologyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
