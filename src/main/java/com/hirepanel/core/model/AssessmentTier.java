package com.hirepanel.core.model;

/**
 * Fixed thresholds on the composite score, highest first.
 */
public enum AssessmentTier {
    EXCEPTIONAL(8.5, "Exceptional", "Strong hire recommendation"),
    VIABLE(8.0, "Viable", "Competitive candidate"),
    BELOW_VIABLE(7.0, "Below-Viable", "Some strengths but significant gaps"),
    WEAK(5.0, "Weak", "Not recommended"),
    POOR(Double.NEGATIVE_INFINITY, "Poor", "Strong rejection");

    private final double threshold;
    private final String label;
    private final String recommendation;

    AssessmentTier(double threshold, String label, String recommendation) {
        this.threshold = threshold;
        this.label = label;
        this.recommendation = recommendation;
    }

    public double threshold() {
        return threshold;
    }

    public String label() {
        return label;
    }

    public String recommendation() {
        return recommendation;
    }

    public static AssessmentTier forScore(double compositeScore) {
        for (AssessmentTier tier : values()) {
            if (compositeScore >= tier.threshold) {
                return tier;
            }
        }
        return POOR;
    }
}
