package com.datamodel.matching.metrics;

import com.datamodel.matching.core.model.InferenceStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordPlanningDuration(Duration.ofMillis(5));
                noOp.recordCandidateConfidence(0.8);
                noOp.incrementDraftMappingSaved(true);
                noOp.incrementRelationshipInferred(InferenceStatus.PENDING);
                noOp.incrementRelationshipSkipped();
                noOp.recordMeceScore(0.65);
                noOp.recordCollisionCount(2);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record planning duration as timer")
        void recordPlanningDuration() {
            metrics.recordPlanningDuration(Duration.ofMillis(15));
            metrics.recordPlanningDuration(Duration.ofMillis(25));

            Timer timer = registry.find("mapping.autoplan.duration").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should record candidate confidence distribution")
        void recordCandidateConfidence() {
            metrics.recordCandidateConfidence(0.9);
            metrics.recordCandidateConfidence(0.5);

            DistributionSummary summary = registry.find("mapping.candidate.confidence").summary();

            assertNotNull(summary);
            assertEquals(2, summary.count());
            assertEquals(1.4, summary.totalAmount(), 0.0001);
        }

        @Test
        @DisplayName("Should tag saved drafts by outcome")
        void incrementDraftMappingSaved() {
            metrics.incrementDraftMappingSaved(true);
            metrics.incrementDraftMappingSaved(true);
            metrics.incrementDraftMappingSaved(false);

            Counter created = registry.find("mapping.draft.saved").tag("outcome", "created").counter();
            Counter updated = registry.find("mapping.draft.saved").tag("outcome", "updated").counter();

            assertNotNull(created);
            assertEquals(2.0, created.count());
            assertNotNull(updated);
            assertEquals(1.0, updated.count());
        }

        @Test
        @DisplayName("Should tag inferred relationships by status")
        void incrementRelationshipInferred() {
            metrics.incrementRelationshipInferred(InferenceStatus.PENDING);
            metrics.incrementRelationshipInferred(InferenceStatus.APPROVED);
            metrics.incrementRelationshipSkipped();

            Counter pending = registry.find("relationship.inferred").tag("status", "pending").counter();
            Counter skipped = registry.find("relationship.skipped").counter();

            assertNotNull(pending);
            assertEquals(1.0, pending.count());
            assertNotNull(skipped);
            assertEquals(1.0, skipped.count());
        }

        @Test
        @DisplayName("Should record MECE score and collision counts")
        void recordModelQuality() {
            metrics.recordMeceScore(0.65);
            metrics.recordCollisionCount(3);

            assertEquals(0.65, registry.find("model.mece.score").summary().totalAmount(), 0.0001);
            assertEquals(3.0, registry.find("model.collisions").summary().totalAmount(), 0.0001);
        }
    }
}
