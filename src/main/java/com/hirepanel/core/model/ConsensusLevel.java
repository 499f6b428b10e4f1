package com.hirepanel.core.model;

/**
 * Agreement between personas, from the spread of their recomputed averages.
 */
public enum ConsensusLevel {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    ConsensusLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ConsensusLevel forVariance(double variance) {
        if (variance <= 0.5) {
            return HIGH;
        }
        return variance <= 1.0 ? MEDIUM : LOW;
    }
}
