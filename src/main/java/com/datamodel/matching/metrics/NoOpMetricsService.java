package com.datamodel.matching.metrics;

import com.datamodel.matching.core.model.InferenceStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordPlanningDuration(Duration duration) {
    }

    @Override
    public void recordCandidateConfidence(double confidence) {
    }

    @Override
    public void incrementDraftMappingSaved(boolean created) {
    }

    @Override
    public void incrementRelationshipInferred(InferenceStatus status) {
    }

    @Override
    public void incrementRelationshipSkipped() {
    }

    @Override
    public void recordMeceScore(double score) {
    }

    @Override
    public void recordCollisionCount(int count) {
    }
}
