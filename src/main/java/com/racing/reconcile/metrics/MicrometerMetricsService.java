package com.racing.reconcile.metrics;

import com.racing.reconcile.core.model.EntityType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconcile.duration}: Timer</li>
 *   <li>{@code reconcile.entity.created}: Counter (tag: entityType)</li>
 *   <li>{@code reconcile.entity.matched}: Counter (tags: entityType, reason)</li>
 *   <li>{@code reconcile.record.skipped}: Counter (tag: entityType)</li>
 *   <li>{@code reconcile.conflict.resolved}: Counter (tag: field)</li>
 *   <li>{@code reconcile.similarity.score}: DistributionSummary</li>
 *   <li>{@code reconcile.batch.size}: DistributionSummary (tag: entityType)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<EntityType, DistributionSummary> batchSizeSummaries = new ConcurrentHashMap<>();
    private final Timer durationTimer;
    private final DistributionSummary similarityScoreSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.durationTimer = Timer.builder("reconcile.duration")
                .description("Duration of reconciliation runs")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("reconcile.similarity.score")
                .description("Distribution of best name similarity scores during driver matching")
                .register(registry);
    }

    @Override
    public void recordReconciliationDuration(Duration duration) {
        durationTimer.record(duration);
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
        String key = "created:" + type.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("reconcile.entity.created")
                        .description("Number of unified entities created")
                        .tag("entityType", type.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementEntityMatched(EntityType type, String reason) {
        String key = "matched:" + type.name() + ":" + reason;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("reconcile.entity.matched")
                        .description("Number of records attached to an existing unified entity")
                        .tag("entityType", type.name())
                        .tag("reason", reason)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementRecordSkipped(EntityType type) {
        String key = "skipped:" + type.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("reconcile.record.skipped")
                        .description("Number of records skipped for lack of an identity field")
                        .tag("entityType", type.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementConflictResolved(String field) {
        String key = "conflict:" + field;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("reconcile.conflict.resolved")
                        .description("Number of contested fields resolved by source priority")
                        .tag("field", field)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordBatchSize(EntityType type, int size) {
        DistributionSummary summary = batchSizeSummaries.computeIfAbsent(type, t ->
                DistributionSummary.builder("reconcile.batch.size")
                        .description("Number of raw records per entity type in a run")
                        .tag("entityType", t.name())
                        .register(registry));
        summary.record(size);
    }
}
