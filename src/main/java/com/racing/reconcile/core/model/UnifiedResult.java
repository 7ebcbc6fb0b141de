package com.racing.reconcile.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One merged classification row for a (race, driver) pair.
 *
 * @param raceId   unified race id
 * @param driverId driver key the sources reported, or the unified driver id when it could be mapped
 * @param position classified position, {@code null} when unclassified or unknown
 * @param points   points scored
 * @param status   normalized finish status
 * @param laps     completed laps
 * @param time     race time or gap text as reported
 * @param sources  contributing sources, highest priority first
 */
public record UnifiedResult(
        int raceId,
        String driverId,
        Integer position,
        Double points,
        String status,
        Integer laps,
        String time,
        List<String> sources
) {
    public UnifiedResult {
        Objects.requireNonNull(driverId, "driverId is required");
        sources = sources != null ? List.copyOf(sources) : List.of();
    }

    /**
     * Returns the originating source when exactly one source reported this row.
     */
    public String getSource() {
        return sources.size() == 1 ? sources.get(0) : null;
    }

    public boolean isMultiSource() {
        return sources.size() > 1;
    }
}
