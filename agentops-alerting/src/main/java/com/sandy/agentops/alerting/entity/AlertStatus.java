package com.sandy.agentops.alerting.entity;

public enum AlertStatus {
    PENDING,
    FIRING,
    RESOLVED
}
