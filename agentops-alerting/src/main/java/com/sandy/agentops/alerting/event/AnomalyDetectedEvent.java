package com.sandy.agentops.alerting.event;

import com.sandy.agentops.alerting.entity.Anomaly;
import lombok.Value;

@Value
public class AnomalyDetectedEvent implements AlertingEvent {

    public static final String TOPIC = "anomaly:detected";

    Anomaly anomaly;

    @Override
    public String topic() {
        return TOPIC;
    }
}
