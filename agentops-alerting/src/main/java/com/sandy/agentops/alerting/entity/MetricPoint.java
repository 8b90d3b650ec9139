package com.sandy.agentops.alerting.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A single sample of a metric. Labels are an optional dimension, e.g. {@code agent=worker-3}.
 */
@Value
@Builder(toBuilder = true)
public class MetricPoint {
    Instant timestamp;
    double value;
    @Builder.Default
    Map<String, String> labels = Map.of();

    /** True if every label in {@code filter} is present here with the same value. */
    public boolean matches(Map<String, String> filter) {
        if (filter == null || filter.isEmpty()) return true;
        for (Map.Entry<String, String> e : filter.entrySet()) {
            if (!e.getValue().equals(labels.get(e.getKey()))) return false;
        }
        return true;
    }
}
