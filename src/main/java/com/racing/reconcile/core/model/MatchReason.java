package com.racing.reconcile.core.model;

/**
 * Which rule produced a driver match.
 */
public enum MatchReason {
    /**
     * Identical three-letter driver code. Takes precedence over any name comparison.
     */
    CODE,

    /**
     * Same car number and a name similarity at or above the threshold.
     */
    NUMBER,

    /**
     * Best name similarity at or above the threshold.
     */
    NAME,

    /**
     * No existing driver qualified.
     */
    NONE
}
