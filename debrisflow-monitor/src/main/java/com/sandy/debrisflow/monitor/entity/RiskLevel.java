package com.sandy.debrisflow.monitor.entity;

/**
 * Ordered risk buckets. A level is only ever derived from a numeric risk value in [0,1].
 */
public enum RiskLevel {
    LOW, MODERATE, HIGH, CRITICAL;

    /**
     * Buckets a risk value against ascending boundaries: below {@code moderate} is LOW,
     * below {@code high} is MODERATE, below {@code critical} is HIGH, anything else CRITICAL.
     */
    public static RiskLevel classify(double riskValue, double moderate, double high, double critical) {
        if (Double.isNaN(riskValue)) {
            throw new IllegalArgumentException("Risk value must be a number");
        }
        if (riskValue < moderate) return LOW;
        if (riskValue < high) return MODERATE;
        if (riskValue < critical) return HIGH;
        return CRITICAL;
    }

    public boolean isAbove(RiskLevel other) {
        return compareTo(other) > 0;
    }
}
