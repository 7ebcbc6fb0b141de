package com.racing.reconcile.core.model;

/**
 * Kinds of unified entities produced by a reconciliation run.
 */
public enum EntityType {
    DRIVER("Driver"),
    CONSTRUCTOR("Constructor"),
    RACE("Race"),
    RESULT("Result");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
