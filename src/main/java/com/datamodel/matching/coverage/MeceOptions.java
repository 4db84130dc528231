package com.datamodel.matching.coverage;

/**
 * Configuration for MECE analysis.
 *
 * @param collisionThreshold minimum name similarity for two attributes to collide
 * @param penaltySaturation  finding count at which each penalty term reaches its maximum
 */
public record MeceOptions(double collisionThreshold, int penaltySaturation) {

    public static final double DEFAULT_COLLISION_THRESHOLD = 0.9;
    public static final int DEFAULT_PENALTY_SATURATION = 10;

    public MeceOptions {
        if (collisionThreshold < 0.0 || collisionThreshold > 1.0) {
            throw new IllegalArgumentException("collisionThreshold must be between 0.0 and 1.0");
        }
        if (penaltySaturation <= 0) {
            throw new IllegalArgumentException("penaltySaturation must be > 0");
        }
    }

    /**
     * Default configuration: collisions at similarity 0.9, penalties saturate at 10 findings.
     */
    public static MeceOptions defaults() {
        return new MeceOptions(DEFAULT_COLLISION_THRESHOLD, DEFAULT_PENALTY_SATURATION);
    }
}
