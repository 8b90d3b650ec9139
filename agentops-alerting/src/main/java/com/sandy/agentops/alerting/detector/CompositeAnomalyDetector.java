package com.sandy.agentops.alerting.detector;

import com.sandy.agentops.alerting.entity.Anomaly;
import com.sandy.agentops.alerting.entity.MetricPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Runs several detectors over the same points and merges their findings. When more than one member flags the
 * same timestamp only the most severe anomaly is kept (ties go to the higher deviation score).
 */
public class CompositeAnomalyDetector implements AnomalyDetector {

    private static final Comparator<Anomaly> BY_SEVERITY =
            Comparator.comparing(Anomaly::getSeverity).thenComparingDouble(Anomaly::getDeviationScore);

    private final List<AnomalyDetector> detectors;

    public CompositeAnomalyDetector(List<AnomalyDetector> detectors) {
        if (detectors == null || detectors.isEmpty()) {
            throw new IllegalArgumentException("at least one detector is required");
        }
        this.detectors = List.copyOf(detectors);
    }

    @Override
    public List<Anomaly> detect(List<MetricPoint> points) {
        Map<Instant, Anomaly> merged = new TreeMap<>();
        for (AnomalyDetector detector : detectors) {
            for (Anomaly a : detector.detect(points)) {
                merged.merge(a.getTimestamp(), a, (prev, next) -> BY_SEVERITY.compare(next, prev) > 0 ? next : prev);
            }
        }
        return new ArrayList<>(merged.values());
    }

    @Override
    public Optional<Duration> preferredLookback() {
        return detectors.stream()
                .map(AnomalyDetector::preferredLookback)
                .flatMap(Optional::stream)
                .max(Comparator.naturalOrder());
    }

    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }

    @Override
    public String getName() {
        return "composite";
    }
}
