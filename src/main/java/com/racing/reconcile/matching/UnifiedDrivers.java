package com.racing.reconcile.matching;

import com.racing.reconcile.core.model.UnifiedDriver;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookups over a list of unified drivers.
 */
public final class UnifiedDrivers {

    private UnifiedDrivers() {
        // Utility class
    }

    public static Optional<UnifiedDriver> findById(List<UnifiedDriver> drivers, int unifiedId) {
        for (UnifiedDriver driver : drivers) {
            if (driver.getUnifiedId() == unifiedId) {
                return Optional.of(driver);
            }
        }
        return Optional.empty();
    }

    /**
     * Maps a source-specific driver id onto the unified driver carrying it.
     * Ids are compared by their text form, so {@code 33} and {@code "33"} are the same id.
     */
    public static Optional<UnifiedDriver> findBySourceId(List<UnifiedDriver> drivers,
                                                         String source, Object sourceId) {
        if (source == null || sourceId == null) {
            return Optional.empty();
        }
        String wanted = sourceId.toString().trim();
        for (UnifiedDriver driver : drivers) {
            Object id = driver.getSourceId(source);
            if (id != null && Objects.equals(id.toString().trim(), wanted)) {
                return Optional.of(driver);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the next dense id after the largest one in use.
     */
    public static int nextId(List<UnifiedDriver> drivers) {
        int max = 0;
        for (UnifiedDriver driver : drivers) {
            max = Math.max(max, driver.getUnifiedId());
        }
        return max + 1;
    }
}
