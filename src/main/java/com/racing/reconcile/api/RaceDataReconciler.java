package com.racing.reconcile.api;

import com.racing.reconcile.core.model.EntityType;
import com.racing.reconcile.core.model.FieldAliases;
import com.racing.reconcile.core.model.RaceKey;
import com.racing.reconcile.core.model.RawRecord;
import com.racing.reconcile.core.model.UnifiedConstructor;
import com.racing.reconcile.core.model.UnifiedDriver;
import com.racing.reconcile.core.model.UnifiedRace;
import com.racing.reconcile.core.model.UnifiedResult;
import com.racing.reconcile.logging.LogContext;
import com.racing.reconcile.matching.DriverMatcher;
import com.racing.reconcile.merge.DataMerger;
import com.racing.reconcile.metrics.MetricsService;
import com.racing.reconcile.metrics.NoOpMetricsService;
import com.racing.reconcile.rules.DataNormalizer;
import com.racing.reconcile.similarity.NameSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the library: reconciles one batch of per-source records into unified
 * drivers, constructors, races and results.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * RaceDataReconciler reconciler = RaceDataReconciler.builder()
 *     .options(ReconciliationOptions.defaults())
 *     .build();
 *
 * SourceBatch batch = SourceBatch.builder()
 *     .drivers("ergast", ergastDrivers)
 *     .drivers("openf1", openF1Drivers)
 *     .races("ergast", ergastRaces)
 *     .results(new RaceKey(2023, 1), "ergast", ergastResults)
 *     .build();
 *
 * ReconciliationResult result = reconciler.reconcile(batch);
 * </pre>
 *
 * <p>A reconciler holds configuration only. Each {@link #reconcile(SourceBatch)} call builds
 * its own collections, so the same input always yields the same unified ids.</p>
 */
public class RaceDataReconciler {
    private static final Logger log = LoggerFactory.getLogger(RaceDataReconciler.class);

    private final ReconciliationOptions options;
    private final DataNormalizer normalizer;
    private final DriverMatcher driverMatcher;
    private final DataMerger merger;
    private final MetricsService metrics;

    private RaceDataReconciler(Builder builder) {
        this.options = builder.options;
        this.metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.normalizer = builder.normalizer != null ? builder.normalizer : new DataNormalizer();
        FieldAliases aliases = FieldAliases.defaults();
        this.driverMatcher = new DriverMatcher(new NameSimilarity(options.getSimilarityAlgorithm()),
                options.getSimilarityThreshold(), normalizer, aliases, metrics);
        this.merger = new DataMerger(options.getSourcePriority(), driverMatcher, normalizer, aliases, metrics);
    }

    /**
     * Reconciles a batch. Never throws for malformed records; they are skipped and logged.
     * A {@code null} batch is reconciled as an empty one.
     */
    public ReconciliationResult reconcile(SourceBatch batch) {
        if (batch == null) {
            log.warn("reconcile.emptyBatch reason=null batch");
            return reconcile(SourceBatch.builder().build());
        }
        String runId = LogContext.generateRunId();
        long start = System.nanoTime();

        try (LogContext runCtx = LogContext.forRun(runId)) {
            log.info("reconcile.starting runId={} records={}", runId, batch.recordCount());

            List<UnifiedDriver> drivers;
            try (LogContext ctx = LogContext.forEntityType(EntityType.DRIVER)) {
                drivers = merger.mergeDrivers(batch.getDrivers());
            }

            List<UnifiedConstructor> constructors;
            try (LogContext ctx = LogContext.forEntityType(EntityType.CONSTRUCTOR)) {
                constructors = merger.mergeConstructors(batch.getConstructors());
            }

            List<UnifiedRace> races;
            try (LogContext ctx = LogContext.forEntityType(EntityType.RACE)) {
                races = merger.mergeRaces(batch.getRaces());
            }

            List<UnifiedResult> results;
            try (LogContext ctx = LogContext.forEntityType(EntityType.RESULT)) {
                results = mergeAllResults(batch.getResults(), races, drivers);
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordReconciliationDuration(duration);
            ReconciliationResult result = new ReconciliationResult(runId, drivers, constructors, races,
                    results, batch.recordCount(), duration);
            log.info("reconcile.completed {}", result);
            return result;
        }
    }

    private List<UnifiedResult> mergeAllResults(Map<RaceKey, Map<String, List<RawRecord>>> resultsByRace,
                                                List<UnifiedRace> races, List<UnifiedDriver> drivers) {
        Map<RaceKey, UnifiedRace> racesByKey = new HashMap<>();
        for (UnifiedRace race : races) {
            racesByKey.put(race.getKey(), race);
        }

        List<UnifiedResult> results = new ArrayList<>();
        for (Map.Entry<RaceKey, Map<String, List<RawRecord>>> entry : resultsByRace.entrySet()) {
            UnifiedRace race = racesByKey.get(entry.getKey());
            if (race == null) {
                log.warn("reconcile.results.orphaned race={} sources={}", entry.getKey(), entry.getValue().keySet());
                continue;
            }
            results.addAll(merger.mergeResults(entry.getValue(), race.getRaceId(), drivers));
        }
        return results;
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    public DataNormalizer getNormalizer() {
        return normalizer;
    }

    public DriverMatcher getDriverMatcher() {
        return driverMatcher;
    }

    public DataMerger getMerger() {
        return merger;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private MetricsService metricsService;
        private DataNormalizer normalizer;

        public Builder options(ReconciliationOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the metrics service. Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder normalizer(DataNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public RaceDataReconciler build() {
            if (options == null) {
                throw new IllegalStateException("options are required");
            }
            return new RaceDataReconciler(this);
        }
    }
}
