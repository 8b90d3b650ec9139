package com.sandy.agentops.alerting.event;

import com.sandy.agentops.alerting.entity.AlertInstance;
import lombok.Value;

@Value
public class AlertFiringEvent implements AlertingEvent {

    public static final String TOPIC = "alert:firing";

    AlertInstance alert;

    @Override
    public String topic() {
        return TOPIC;
    }
}
