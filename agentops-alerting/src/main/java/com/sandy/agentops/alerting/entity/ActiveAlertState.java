package com.sandy.agentops.alerting.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Transient per-rule state, present only while a breach is ongoing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveAlertState {
    private String ruleId;
    private AlertStatus status;
    private Instant firstBreachAt;
    /** Null while pending. */
    private Instant lastFiredAt;
    private double currentValue;
}
