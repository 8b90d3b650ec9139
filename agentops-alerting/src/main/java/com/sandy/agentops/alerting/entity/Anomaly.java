package com.sandy.agentops.alerting.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Anomaly {
    Instant timestamp;
    /** Filled in by the detection service; detectors only see points. */
    String metric;
    double value;
    /** Baseline the value was compared with (mean, median, bucket mean or forecast). */
    double expected;
    double deviationScore;
    AnomalySeverity severity;
    /** Name of the detector that produced this anomaly. */
    String detector;
}
