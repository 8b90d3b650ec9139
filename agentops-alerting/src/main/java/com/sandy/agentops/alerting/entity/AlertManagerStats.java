package com.sandy.agentops.alerting.entity;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AlertManagerStats {
    int activeAlertCount;
    int ruleCount;
    int detectorCount;
    /** Lifetime count of firing notifications, never reset. */
    long totalAlertsFired;
    boolean running;
}
