package com.racing.reconcile.metrics;

import com.racing.reconcile.core.model.EntityType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordReconciliationDuration(Duration duration) {
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
    }

    @Override
    public void incrementEntityMatched(EntityType type, String reason) {
    }

    @Override
    public void incrementRecordSkipped(EntityType type) {
    }

    @Override
    public void incrementConflictResolved(String field) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordBatchSize(EntityType type, int size) {
    }
}
