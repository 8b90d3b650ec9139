package com.sandy.agentops.alerting.service.impl;

import com.sandy.agentops.alerting.entity.MetricPoint;
import com.sandy.agentops.alerting.entity.TimeSeriesQuery;
import com.sandy.agentops.alerting.service.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default store keeping the newest {@code maxPointsPerSeries} samples of every metric in memory.
 * Each metric is locked independently so writers of different metrics never contend.
 */
@Slf4j
public class InMemoryTimeSeriesStore implements TimeSeriesStore {

    private final Clock clock;
    private final int maxPointsPerSeries;
    // metric -> points sorted by timestamp, oldest first
    private final Map<String, Series> store = new ConcurrentHashMap<>();

    public InMemoryTimeSeriesStore(Clock clock, int maxPointsPerSeries) {
        if (maxPointsPerSeries <= 0) {
            throw new IllegalArgumentException("maxPointsPerSeries must be positive: " + maxPointsPerSeries);
        }
        this.clock = clock;
        this.maxPointsPerSeries = maxPointsPerSeries;
    }

    @Override
    public void write(String metric, double value, Map<String, String> labels, Instant timestamp) {
        if (metric == null || metric.isBlank()) {
            throw new IllegalArgumentException("metric name is required");
        }
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("value for " + metric + " is not a number");
        }
        MetricPoint point = MetricPoint.builder()
                .timestamp(timestamp != null ? timestamp : clock.instant())
                .value(value)
                .labels(labels == null ? Map.of() : Map.copyOf(labels))
                .build();
        store.computeIfAbsent(metric, k -> new Series()).add(point, maxPointsPerSeries);
    }

    @Override
    public List<MetricPoint> query(TimeSeriesQuery query) {
        Series series = store.get(query.getMetric());
        if (series == null) return Collections.emptyList();
        return series.range(query.getStart(), query.getEnd(), query.getLabels());
    }

    @Override
    public void clear() {
        store.clear();
        log.debug("In-memory time series store cleared");
    }

    private static class Series {
        private final ArrayList<MetricPoint> points = new ArrayList<>();

        synchronized void add(MetricPoint point, int maxPoints) {
            // samples normally arrive in order, so this is an append
            int idx = points.size();
            while (idx > 0 && points.get(idx - 1).getTimestamp().isAfter(point.getTimestamp())) {
                idx--;
            }
            points.add(idx, point);
            if (points.size() > maxPoints) {
                points.subList(0, points.size() - maxPoints).clear();
            }
        }

        synchronized List<MetricPoint> range(Instant start, Instant end, Map<String, String> labels) {
            List<MetricPoint> result = new ArrayList<>();
            for (int i = firstIndexAtOrAfter(start); i < points.size(); i++) {
                MetricPoint p = points.get(i);
                if (end != null && p.getTimestamp().isAfter(end)) break;
                if (p.matches(labels)) result.add(p);
            }
            return result;
        }

        private int firstIndexAtOrAfter(Instant start) {
            if (start == null) return 0;
            int lo = 0;
            int hi = points.size();
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (points.get(mid).getTimestamp().isBefore(start)) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            return lo;
        }
    }
}
