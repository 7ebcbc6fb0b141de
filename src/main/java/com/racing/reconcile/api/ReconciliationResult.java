package com.racing.reconcile.api;

import com.racing.reconcile.core.model.UnifiedConstructor;
import com.racing.reconcile.core.model.UnifiedDriver;
import com.racing.reconcile.core.model.UnifiedRace;
import com.racing.reconcile.core.model.UnifiedResult;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The unified collections produced by one reconciliation run, in creation order.
 *
 * @param runId        identifier used in log context for this run
 * @param drivers      unified drivers
 * @param constructors unified constructors
 * @param races        unified races
 * @param results      merged results of every race that had both a unified race and results
 * @param recordCount  raw records in the batch
 * @param duration     wall-clock time of the run
 */
public record ReconciliationResult(
        String runId,
        List<UnifiedDriver> drivers,
        List<UnifiedConstructor> constructors,
        List<UnifiedRace> races,
        List<UnifiedResult> results,
        int recordCount,
        Duration duration
) {
    public ReconciliationResult {
        drivers = drivers != null ? List.copyOf(drivers) : List.of();
        constructors = constructors != null ? List.copyOf(constructors) : List.of();
        races = races != null ? List.copyOf(races) : List.of();
        results = results != null ? List.copyOf(results) : List.of();
    }

    public List<UnifiedResult> resultsForRace(int raceId) {
        return results.stream()
                .filter(r -> r.raceId() == raceId)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "ReconciliationResult{runId=" + runId +
                ", drivers=" + drivers.size() +
                ", constructors=" + constructors.size() +
                ", races=" + races.size() +
                ", results=" + results.size() +
                ", records=" + recordCount +
                ", duration=" + duration + '}';
    }
}
