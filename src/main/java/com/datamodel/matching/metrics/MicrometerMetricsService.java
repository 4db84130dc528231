package com.datamodel.matching.metrics;

import com.datamodel.matching.core.model.InferenceStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code mapping.autoplan.duration} - Timer</li>
 *   <li>{@code mapping.candidate.confidence} - DistributionSummary</li>
 *   <li>{@code mapping.draft.saved} - Counter (tag: outcome=created|updated)</li>
 *   <li>{@code relationship.inferred} - Counter (tag: status)</li>
 *   <li>{@code relationship.skipped} - Counter</li>
 *   <li>{@code model.mece.score} - DistributionSummary</li>
 *   <li>{@code model.collisions} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer planningTimer;
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary meceScoreSummary;
    private final DistributionSummary collisionSummary;
    private final Counter skippedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.planningTimer = Timer.builder("mapping.autoplan.duration")
                .description("Duration of mapping planning runs")
                .register(registry);
        this.confidenceSummary = DistributionSummary.builder("mapping.candidate.confidence")
                .description("Confidence of returned mapping candidates")
                .register(registry);
        this.meceScoreSummary = DistributionSummary.builder("model.mece.score")
                .description("MECE scores of analyzed models")
                .register(registry);
        this.collisionSummary = DistributionSummary.builder("model.collisions")
                .description("Attribute collisions found per analyzed model")
                .register(registry);
        this.skippedCounter = Counter.builder("relationship.skipped")
                .description("Manual relationships left untouched by inference")
                .register(registry);
    }

    @Override
    public void recordPlanningDuration(Duration duration) {
        planningTimer.record(duration);
    }

    @Override
    public void recordCandidateConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementDraftMappingSaved(boolean created) {
        String outcome = created ? "created" : "updated";
        counter("mapping.draft.saved", "outcome", outcome,
                "Draft mappings written by planning runs").increment();
    }

    @Override
    public void incrementRelationshipInferred(InferenceStatus status) {
        counter("relationship.inferred", "status", status.wireValue(),
                "Relationships updated with inference evidence").increment();
    }

    @Override
    public void incrementRelationshipSkipped() {
        skippedCounter.increment();
    }

    @Override
    public void recordMeceScore(double score) {
        meceScoreSummary.record(score);
    }

    @Override
    public void recordCollisionCount(int count) {
        collisionSummary.record(count);
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        String key = name + ":" + tagValue;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
