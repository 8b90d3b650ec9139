package com.sandy.agentops.alerting.event;

import com.sandy.agentops.alerting.entity.AlertInstance;
import lombok.Value;

@Value
public class AlertResolvedEvent implements AlertingEvent {

    public static final String TOPIC = "alert:resolved";

    AlertInstance alert;

    @Override
    public String topic() {
        return TOPIC;
    }
}
