package com.racing.reconcile.rules;

/**
 * Closed vocabulary of normalized finish statuses.
 * Status text that fits none of these passes through unchanged.
 */
public enum FinishStatus {
    FINISHED("Finished"),
    DNF("DNF"),
    DNS("DNS"),
    DSQ("DSQ"),
    WITHDREW("Withdrew"),
    UNKNOWN("Unknown");

    private final String label;

    FinishStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static boolean isVocabulary(String status) {
        for (FinishStatus value : values()) {
            if (value.label.equals(status)) {
                return true;
            }
        }
        return false;
    }
}
