package com.datamodel.matching.core.model;

/**
 * Lifecycle of a persisted attribute-to-column mapping.
 */
public enum MappingStatus {
    /** Machine-proposed; replaced on every planning run. */
    DRAFT,
    APPROVED,
    REJECTED
}
