package com.datamodel.matching.core.model;

/**
 * Per-signal scores behind a mapping candidate's confidence. Each value is in [0, 1].
 */
public record ComponentScores(double name, double dtype, double semantic, double evidence) {

    public ComponentScores {
        name = clamp(name);
        dtype = clamp(dtype);
        semantic = clamp(semantic);
        evidence = clamp(evidence);
    }

    public static ComponentScores zero() {
        return new ComponentScores(0.0, 0.0, 0.0, 0.0);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public String toString() {
        return String.format("ComponentScores{name=%.4f, dtype=%.4f, semantic=%.4f, evidence=%.4f}",
                name, dtype, semantic, evidence);
    }
}
