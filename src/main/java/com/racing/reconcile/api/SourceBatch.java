package com.racing.reconcile.api;

import com.racing.reconcile.core.model.RaceKey;
import com.racing.reconcile.core.model.RawRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The raw records of one reconciliation run, per entity type and per source.
 * Results are additionally keyed by the race they classify.
 */
public final class SourceBatch {

    private final Map<String, List<RawRecord>> drivers;
    private final Map<String, List<RawRecord>> constructors;
    private final Map<String, List<RawRecord>> races;
    private final Map<RaceKey, Map<String, List<RawRecord>>> results;

    private SourceBatch(Builder builder) {
        this.drivers = freeze(builder.drivers);
        this.constructors = freeze(builder.constructors);
        this.races = freeze(builder.races);
        Map<RaceKey, Map<String, List<RawRecord>>> frozenResults = new LinkedHashMap<>();
        builder.results.forEach((key, bySource) -> frozenResults.put(key, freeze(bySource)));
        this.results = Collections.unmodifiableMap(frozenResults);
    }

    public Map<String, List<RawRecord>> getDrivers() {
        return drivers;
    }

    public Map<String, List<RawRecord>> getConstructors() {
        return constructors;
    }

    public Map<String, List<RawRecord>> getRaces() {
        return races;
    }

    public Map<RaceKey, Map<String, List<RawRecord>>> getResults() {
        return results;
    }

    public int recordCount() {
        int count = count(drivers) + count(constructors) + count(races);
        for (Map<String, List<RawRecord>> bySource : results.values()) {
            count += count(bySource);
        }
        return count;
    }

    private static int count(Map<String, List<RawRecord>> bySource) {
        int count = 0;
        for (List<RawRecord> records : bySource.values()) {
            count += records.size();
        }
        return count;
    }

    private static Map<String, List<RawRecord>> freeze(Map<String, List<RawRecord>> bySource) {
        Map<String, List<RawRecord>> frozen = new LinkedHashMap<>();
        bySource.forEach((source, records) -> frozen.put(source, List.copyOf(records)));
        return Collections.unmodifiableMap(frozen);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, List<RawRecord>> drivers = new LinkedHashMap<>();
        private final Map<String, List<RawRecord>> constructors = new LinkedHashMap<>();
        private final Map<String, List<RawRecord>> races = new LinkedHashMap<>();
        private final Map<RaceKey, Map<String, List<RawRecord>>> results = new LinkedHashMap<>();

        public Builder drivers(String source, List<RawRecord> records) {
            append(drivers, source, records);
            return this;
        }

        public Builder constructors(String source, List<RawRecord> records) {
            append(constructors, source, records);
            return this;
        }

        public Builder races(String source, List<RawRecord> records) {
            append(races, source, records);
            return this;
        }

        public Builder results(RaceKey race, String source, List<RawRecord> records) {
            Objects.requireNonNull(race, "race is required");
            append(results.computeIfAbsent(race, k -> new LinkedHashMap<>()), source, records);
            return this;
        }

        private static void append(Map<String, List<RawRecord>> bySource, String source, List<RawRecord> records) {
            Objects.requireNonNull(source, "source is required");
            List<RawRecord> target = bySource.computeIfAbsent(source, k -> new ArrayList<>());
            if (records != null) {
                for (RawRecord record : records) {
                    if (record != null) {
                        target.add(record);
                    }
                }
            }
        }

        public SourceBatch build() {
            return new SourceBatch(this);
        }
    }
}
