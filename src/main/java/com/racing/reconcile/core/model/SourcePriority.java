package com.racing.reconcile.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Authority ranking of data sources. Higher scores win field conflicts.
 * Sources missing from the table score {@value #UNLISTED_PRIORITY}.
 */
public final class SourcePriority {

    public static final int UNLISTED_PRIORITY = 0;

    public static final String ERGAST = "ergast";
    public static final String FIA = "fia";
    public static final String OPENF1 = "openf1";
    public static final String FASTF1 = "fastf1";
    public static final String F1COM = "f1com";
    public static final String STATSF1 = "statsf1";
    public static final String WIKIPEDIA = "wikipedia";

    private static final SourcePriority DEFAULTS = builder()
            .priority(ERGAST, 10)
            .priority(FIA, 9)
            .priority(OPENF1, 8)
            .priority(FASTF1, 8)
            .priority(F1COM, 7)
            .priority(STATSF1, 6)
            .priority(WIKIPEDIA, 3)
            .build();

    private final Map<String, Integer> priorities;

    private SourcePriority(Map<String, Integer> priorities) {
        this.priorities = Collections.unmodifiableMap(new LinkedHashMap<>(priorities));
    }

    /**
     * The fixed production table: historical archive first, then official documents,
     * telemetry feeds, the official website, third-party statistics and cross-reference sites.
     */
    public static SourcePriority defaults() {
        return DEFAULTS;
    }

    public int priorityOf(String source) {
        if (source == null) {
            return UNLISTED_PRIORITY;
        }
        return priorities.getOrDefault(source, UNLISTED_PRIORITY);
    }

    public Map<String, Integer> asMap() {
        return priorities;
    }

    /**
     * Orders the entries of a source-keyed mapping by descending priority.
     * The sort is stable, so sources of equal priority keep the caller's iteration order.
     */
    public <V> List<Map.Entry<String, V>> orderSources(Map<String, V> bySource) {
        if (bySource == null || bySource.isEmpty()) {
            return List.of();
        }
        List<Map.Entry<String, V>> entries = new ArrayList<>(bySource.entrySet());
        entries.sort(Comparator.comparingInt(
                (Map.Entry<String, V> e) -> priorityOf(e.getKey())).reversed());
        return entries;
    }

    /**
     * Returns a copy of this table with one source's score replaced.
     */
    public SourcePriority with(String source, int priority) {
        return builder(this).priority(source, priority).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourcePriority that = (SourcePriority) o;
        return priorities.equals(that.priorities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(priorities);
    }

    @Override
    public String toString() {
        return "SourcePriority" + priorities;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(SourcePriority base) {
        Builder builder = new Builder();
        builder.priorities.putAll(base.priorities);
        return builder;
    }

    public static class Builder {
        private final Map<String, Integer> priorities = new LinkedHashMap<>();

        public Builder priority(String source, int priority) {
            Objects.requireNonNull(source, "source is required");
            if (priority < 0) {
                throw new IllegalArgumentException("Priority must be non-negative, got " + priority
                        + " for source " + source);
            }
            priorities.put(source, priority);
            return this;
        }

        public SourcePriority build() {
            return new SourcePriority(priorities);
        }
    }
}
