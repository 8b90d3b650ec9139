package com.sandy.agentops.alerting.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Threshold alert rule. Identity is {@link #id}; rules are registered and replaced through the rule engine.
 */
@Value
@Builder(toBuilder = true)
public class AlertRule {
    String id;
    String name;
    String description;
    @Builder.Default
    boolean enabled = true;
    AlertSeverity severity;

    /** Metric name to watch. */
    String metric;
    ComparisonOperator operator;
    double threshold;
    /** How long the breach must persist before the alert fires. Zero fires on first breach. */
    @Builder.Default
    Duration forDuration = Duration.ZERO;

    /** Optional label filter; only samples carrying all of these labels are considered. */
    @Builder.Default
    Map<String, String> labels = Map.of();

    @Builder.Default
    List<AlertAction> actions = List.of();

    /** Minimum time between two firing notifications while the breach continues. */
    @Builder.Default
    Duration cooldown = Duration.ZERO;
}
