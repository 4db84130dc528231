package com.datamodel.matching.exception;

/**
 * Thrown when a top-level payload is structurally invalid, e.g. model JSON that
 * does not parse or is not a JSON object. Callers should surface it as a client
 * error and not retry.
 */
public class ModelValidationException extends IllegalArgumentException {

    public ModelValidationException(String message) {
        super(message);
    }

    public ModelValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
