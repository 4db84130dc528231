package com.datamodel.matching.core.model;

/**
 * Statistical evidence for a foreign-key edge. Either value is null when unknown.
 *
 * @param coverage           share of child rows carrying a key, in [0, 1]
 * @param childPerParentMean child rows per distinct parent key
 */
public record FkEvidence(Double coverage, Double childPerParentMean) {

    private static final FkEvidence NONE = new FkEvidence(null, null);

    public static FkEvidence none() {
        return NONE;
    }
}
