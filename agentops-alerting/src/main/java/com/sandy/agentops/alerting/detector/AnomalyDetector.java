package com.sandy.agentops.alerting.detector;

import com.sandy.agentops.alerting.entity.Anomaly;
import com.sandy.agentops.alerting.entity.MetricPoint;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Flags anomalous samples in a time-ordered sequence.
 * <p>
 * Implementations are deterministic and side-effect free: the same input always yields the same anomalies,
 * and too little data yields an empty list rather than an exception.
 */
public interface AnomalyDetector {

    List<Anomaly> detect(List<MetricPoint> points);

    /** Short identifier written into every anomaly this detector produces. */
    String getName();

    /** Window of history this detector needs, if longer than the service default. */
    default Optional<Duration> preferredLookback() {
        return Optional.empty();
    }
}
