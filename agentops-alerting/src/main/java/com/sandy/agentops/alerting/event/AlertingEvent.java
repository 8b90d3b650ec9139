package com.sandy.agentops.alerting.event;

/**
 * Notification published on the application event channel by the alerting engines.
 */
public interface AlertingEvent {

    /** Channel name, e.g. {@code alert:firing}. */
    String topic();
}
