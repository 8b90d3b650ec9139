package com.sandy.agentops.alerting.entity;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
