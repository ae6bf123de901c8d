package com.example.dbmonitor.query;

/**
 * Performance band of a query by mean execution time.
 */
public enum QueryPerformanceCategory {

    SLOW("Slow Query", "high"),
    MEDIUM("Medium Query", "medium"),
    FAST("Fast Query", "low");

    private final String label;
    private final String severity;

    QueryPerformanceCategory(String label, String severity) {
        this.label = label;
        this.severity = severity;
    }

    public static QueryPerformanceCategory of(double meanTimeMs, double criticalThresholdMs, double warningThresholdMs) {
        if (meanTimeMs > criticalThresholdMs) return SLOW;
        if (meanTimeMs > warningThresholdMs) return MEDIUM;
        return FAST;
    }

    public String label() {
        return label;
    }

    public String severity() {
        return severity;
    }
}
