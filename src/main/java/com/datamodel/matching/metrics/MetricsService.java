package com.datamodel.matching.metrics;

import com.datamodel.matching.core.model.InferenceStatus;

import java.time.Duration;

/**
 * Interface for recording matching engine metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordPlanningDuration(Duration duration);

    void recordCandidateConfidence(double confidence);

    void incrementDraftMappingSaved(boolean created);

    void incrementRelationshipInferred(InferenceStatus status);

    void incrementRelationshipSkipped();

    void recordMeceScore(double score);

    void recordCollisionCount(int count);
}
