package com.sandy.agentops.alerting.service;

import com.sandy.agentops.alerting.detector.AnomalyDetector;
import com.sandy.agentops.alerting.entity.Anomaly;
import com.sandy.agentops.alerting.entity.MetricPoint;
import com.sandy.agentops.alerting.entity.TimeSeriesQuery;
import com.sandy.agentops.alerting.event.AnomalyDetectedEvent;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one registered detector per metric over a recent window of samples and keeps a bounded history of what
 * was found.
 * <p>
 * Every run replays the whole window, so the same outlier is seen again on later runs. Each metric keeps the
 * timestamp and value of the anomalies it already reported, so every anomaly is recorded and published once,
 * including late samples written behind newer ones. Keys that fall out of the detection window are dropped.
 */
@Slf4j
public class AnomalyDetectionService {

    public static final Duration DEFAULT_LOOKBACK = Duration.ofHours(1);
    public static final int DEFAULT_MAX_HISTORY = 1000;

    private final TimeSeriesStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration defaultLookback;
    private final int maxHistoryPerMetric;

    private final Map<String, AnomalyDetector> detectors = new ConcurrentHashMap<>();
    private final Map<String, Deque<Anomaly>> history = new ConcurrentHashMap<>();
    private final Map<String, Set<ReportKey>> reported = new ConcurrentHashMap<>();

    public AnomalyDetectionService(TimeSeriesStore store,
                                   ApplicationEventPublisher eventPublisher,
                                   Clock clock,
                                   Duration defaultLookback,
                                   int maxHistoryPerMetric) {
        if (maxHistoryPerMetric <= 0) {
            throw new IllegalArgumentException("maxHistoryPerMetric must be positive: " + maxHistoryPerMetric);
        }
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.defaultLookback = defaultLookback;
        this.maxHistoryPerMetric = maxHistoryPerMetric;
    }

    /** Registers (or replaces) the detector for a metric. Use a composite to run several. */
    public void addDetector(String metric, AnomalyDetector detector) {
        if (metric == null || metric.isBlank()) throw new IllegalArgumentException("metric name is required");
        if (detector == null) throw new IllegalArgumentException("detector is required");
        AnomalyDetector previous = detectors.put(metric, detector);
        log.info("Anomaly detector {} metric={} detector={}", previous == null ? "registered" : "replaced", metric, detector.getName());
    }

    public boolean removeDetector(String metric) {
        boolean removed = detectors.remove(metric) != null;
        if (removed) {
            reported.remove(metric);
            log.info("Anomaly detector removed metric={}", metric);
        }
        return removed;
    }

    public Optional<AnomalyDetector> getDetector(String metric) {
        return Optional.ofNullable(detectors.get(metric));
    }

    public Set<String> getMonitoredMetrics() {
        return Set.copyOf(detectors.keySet());
    }

    public int getDetectorCount() {
        return detectors.size();
    }

    /**
     * Runs every registered detector once.
     * <p>
     * Windows for all metrics are read before anything is recorded, so a {@link StorageUnavailableException}
     * leaves history untouched.
     * <p>
     * The result is not everything the detectors found in this run: anomalies already reported by an earlier
     * run are left out, since the window overlaps the previous one. The full record is {@link #getHistory}.
     *
     * @return anomalies not reported by any earlier run, across all metrics
     */
    public synchronized List<Anomaly> runDetection() {
        Instant now = clock.instant();
        List<Window> windows = new ArrayList<>();
        for (Map.Entry<String, AnomalyDetector> e : detectors.entrySet()) {
            AnomalyDetector detector = e.getValue();
            Duration lookback = detector.preferredLookback()
                    .filter(d -> d.compareTo(defaultLookback) > 0)
                    .orElse(defaultLookback);
            Instant start = now.minus(lookback);
            List<MetricPoint> points = store.query(TimeSeriesQuery.builder()
                    .metric(e.getKey())
                    .start(start)
                    .end(now)
                    .build());
            windows.add(new Window(e.getKey(), detector, start, points));
        }

        List<Anomaly> found = new ArrayList<>();
        for (Window w : windows) {
            List<Anomaly> detected;
            try {
                detected = w.getDetector().detect(w.getPoints());
            } catch (RuntimeException ex) {
                log.error("Anomaly detector failed metric={} detector={} error={}",
                        w.getMetric(), w.getDetector().getName(), ex.getMessage(), ex);
                continue;
            }
            Set<ReportKey> seen = reported.computeIfAbsent(w.getMetric(), k -> ConcurrentHashMap.newKeySet());
            seen.removeIf(k -> k.getTimestamp().isBefore(w.getStart()));
            for (Anomaly a : detected) {
                if (!seen.add(new ReportKey(a.getTimestamp(), a.getValue()))) continue;
                Anomaly anomaly = a.toBuilder().metric(w.getMetric()).build();
                record(anomaly);
                found.add(anomaly);
                publish(anomaly);
            }
        }
        if (!windows.isEmpty()) {
            log.debug("Anomaly detection completed. metrics={} newAnomalies={}", windows.size(), found.size());
        }
        return found;
    }

    private void record(Anomaly anomaly) {
        Deque<Anomaly> q = history.computeIfAbsent(anomaly.getMetric(), k -> new ArrayDeque<>());
        synchronized (q) {
            q.addLast(anomaly);
            while (q.size() > maxHistoryPerMetric) q.removeFirst();
        }
    }

    private void publish(Anomaly anomaly) {
        try {
            eventPublisher.publishEvent(new AnomalyDetectedEvent(anomaly));
        } catch (RuntimeException e) {
            log.error("Event subscriber failed topic={} error={}", AnomalyDetectedEvent.TOPIC, e.getMessage(), e);
        }
    }

    /** Retained anomalies for a metric, oldest first. */
    public List<Anomaly> getHistory(String metric) {
        Deque<Anomaly> q = history.get(metric);
        if (q == null) return Collections.emptyList();
        synchronized (q) {
            return List.copyOf(q);
        }
    }

    public void clearHistory() {
        history.clear();
        reported.clear();
    }

    @Value
    private static class Window {
        String metric;
        AnomalyDetector detector;
        Instant start;
        List<MetricPoint> points;
    }

    @Value
    private static class ReportKey {
        Instant timestamp;
        double value;
    }
}
