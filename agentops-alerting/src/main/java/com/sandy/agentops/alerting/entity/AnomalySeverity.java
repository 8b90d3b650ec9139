package com.sandy.agentops.alerting.entity;

public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Grades a deviation score against the detector threshold it exceeded. Higher ratios never grade lower.
     */
    public static AnomalySeverity forScore(double score, double threshold) {
        double ratio = threshold > 0 ? score / threshold : score;
        if (ratio >= 3.0) return CRITICAL;
        if (ratio >= 1.5) return HIGH;
        if (ratio >= 1.25) return MEDIUM;
        return LOW;
    }
}
