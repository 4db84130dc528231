package com.datamodel.matching.core.model;

/**
 * Cardinality classification derived from relationship evidence.
 */
public enum Cardinality {
    ONE_TO_MANY("one_to_many"),
    ONE_TO_ONE("one_to_one"),

    /**
     * Evidence is insufficient to override the proposed relationship type.
     */
    UNDETERMINED("");

    private final String wireValue;

    Cardinality(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Value used in relationship payloads; empty for {@link #UNDETERMINED}.
     */
    public String wireValue() {
        return wireValue;
    }

    public boolean isDetermined() {
        return this != UNDETERMINED;
    }
}
