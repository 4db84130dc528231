package com.datamodel.matching.similarity;

/**
 * Weights of the four signals blended into a mapping candidate's confidence.
 *
 * <p>{@link #CONTRACT} is the published blend (0.5 name, 0.2 datatype, 0.2 semantic,
 * 0.1 evidence). Confidence values are compared across runs and stored with draft
 * mappings, so the planner always scores with this instance.</p>
 */
public record SignalWeights(
        double nameWeight,
        double dtypeWeight,
        double semanticWeight,
        double evidenceWeight
) {
    public static final SignalWeights CONTRACT = new SignalWeights(0.5, 0.2, 0.2, 0.1);

    public SignalWeights {
        if (nameWeight < 0 || dtypeWeight < 0 || semanticWeight < 0 || evidenceWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = nameWeight + dtypeWeight + semanticWeight + evidenceWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }
}
