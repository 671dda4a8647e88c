package com.aitracker.dedup.service.dedup;

/**
 * Check that settled a candidate, in the order the checks run.
 */
public enum DedupStage {
    EXACT_URL("Exact URL"),
    NORMALIZED_URL("Normalized URL"),
    CROSS_CYCLE("Cross-cycle"),
    IN_CYCLE("In-cycle"),
    UNIQUE("Unique");

    private final String label;

    DedupStage(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
