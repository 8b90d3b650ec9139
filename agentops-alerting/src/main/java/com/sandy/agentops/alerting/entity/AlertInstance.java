package com.sandy.agentops.alerting.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of an alert as reported to subscribers and action handlers.
 */
@Value
@Builder(toBuilder = true)
public class AlertInstance {
    /** ruleId plus label set, stable for the lifetime of the rule. */
    String id;
    String ruleId;
    String ruleName;
    String metric;
    AlertSeverity severity;
    AlertStatus status;
    /** When the breach was first observed. */
    Instant startedAt;
    Instant firedAt;
    Instant resolvedAt;
    double value;
    double threshold;
    ComparisonOperator operator;
    String message;
    @Builder.Default
    Map<String, String> labels = Map.of();
}
