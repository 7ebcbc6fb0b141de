package com.racing.reconcile.core.model;

import java.util.Objects;

/**
 * Outcome of matching one incoming record against the unified drivers seen so far.
 */
public record MatchResult(
        double score,
        MatchReason reason,
        Integer unifiedId,
        String matchedName
) {
    public MatchResult {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
        Objects.requireNonNull(reason, "reason is required");
        if (reason != MatchReason.NONE && unifiedId == null) {
            throw new IllegalArgumentException("A match requires a unifiedId");
        }
    }

    public static MatchResult noMatch() {
        return new MatchResult(0.0, MatchReason.NONE, null, null);
    }

    /**
     * A no-match that still remembers the best score seen, for diagnostics.
     */
    public static MatchResult noMatch(double bestScore) {
        return new MatchResult(bestScore, MatchReason.NONE, null, null);
    }

    public static MatchResult byCode(UnifiedDriver driver) {
        return new MatchResult(1.0, MatchReason.CODE, driver.getUnifiedId(), driver.getFullName());
    }

    public static MatchResult byNumber(UnifiedDriver driver, double score) {
        return new MatchResult(score, MatchReason.NUMBER, driver.getUnifiedId(), driver.getFullName());
    }

    public static MatchResult byName(UnifiedDriver driver, double score) {
        return new MatchResult(score, MatchReason.NAME, driver.getUnifiedId(), driver.getFullName());
    }

    public boolean hasMatch() {
        return reason != MatchReason.NONE;
    }
}
