package com.racing.reconcile.metrics;

import com.racing.reconcile.core.model.EntityType;
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
                noOp.recordReconciliationDuration(Duration.ofMillis(100));
                noOp.incrementEntityCreated(EntityType.DRIVER);
                noOp.incrementEntityMatched(EntityType.DRIVER, "code");
                noOp.incrementRecordSkipped(EntityType.RACE);
                noOp.incrementConflictResolved("position");
                noOp.recordSimilarityScore(0.85);
                noOp.recordBatchSize(EntityType.RESULT, 20);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record run duration as timer")
        void recordReconciliationDuration() {
            metrics.recordReconciliationDuration(Duration.ofMillis(150));
            metrics.recordReconciliationDuration(Duration.ofMillis(250));

            Timer timer = registry.find("reconcile.duration").timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
        }

        @Test
        @DisplayName("Should increment entity created counter per type")
        void incrementEntityCreated() {
            metrics.incrementEntityCreated(EntityType.DRIVER);
            metrics.incrementEntityCreated(EntityType.DRIVER);
            metrics.incrementEntityCreated(EntityType.RACE);

            Counter drivers = registry.find("reconcile.entity.created").tag("entityType", "DRIVER").counter();
            Counter races = registry.find("reconcile.entity.created").tag("entityType", "RACE").counter();

            assertNotNull(drivers);
            assertEquals(2.0, drivers.count());
            assertNotNull(races);
            assertEquals(1.0, races.count());
        }

        @Test
        @DisplayName("Should tag matches with their reason")
        void incrementEntityMatched() {
            metrics.incrementEntityMatched(EntityType.DRIVER, "code");
            metrics.incrementEntityMatched(EntityType.DRIVER, "name");
            metrics.incrementEntityMatched(EntityType.DRIVER, "code");

            Counter byCode = registry.find("reconcile.entity.matched")
                    .tag("entityType", "DRIVER")
                    .tag("reason", "code")
                    .counter();

            assertNotNull(byCode);
            assertEquals(2.0, byCode.count());
        }

        @Test
        @DisplayName("Should count skipped records and resolved conflicts")
        void skippedAndConflicts() {
            metrics.incrementRecordSkipped(EntityType.RESULT);
            metrics.incrementConflictResolved("position");
            metrics.incrementConflictResolved("position");

            Counter skipped = registry.find("reconcile.record.skipped").tag("entityType", "RESULT").counter();
            Counter conflicts = registry.find("reconcile.conflict.resolved").tag("field", "position").counter();

            assertNotNull(skipped);
            assertEquals(1.0, skipped.count());
            assertNotNull(conflicts);
            assertEquals(2.0, conflicts.count());
        }

        @Test
        @DisplayName("Should record similarity scores and batch sizes")
        void distributions() {
            metrics.recordSimilarityScore(0.9);
            metrics.recordSimilarityScore(0.5);
            metrics.recordBatchSize(EntityType.DRIVER, 20);

            DistributionSummary scores = registry.find("reconcile.similarity.score").summary();
            DistributionSummary batch = registry.find("reconcile.batch.size").tag("entityType", "DRIVER").summary();

            assertNotNull(scores);
            assertEquals(2, scores.count());
            assertEquals(1.4, scores.totalAmount(), 1e-9);
            assertNotNull(batch);
            assertEquals(20.0, batch.totalAmount());
        }
    }
}
