package com.racing.reconcile.metrics;

import com.racing.reconcile.core.model.EntityType;

import java.time.Duration;

/**
 * Records reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library runs without any
 * metrics backend on the classpath.
 */
public interface MetricsService {

    void recordReconciliationDuration(Duration duration);

    void incrementEntityCreated(EntityType type);

    /**
     * @param reason how the record was attached, e.g. {@code code}, {@code name} or {@code natural-key}
     */
    void incrementEntityMatched(EntityType type, String reason);

    void incrementRecordSkipped(EntityType type);

    void incrementConflictResolved(String field);

    void recordSimilarityScore(double score);

    void recordBatchSize(EntityType type, int size);
}
