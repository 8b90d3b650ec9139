package com.sandy.agentops.alerting.detector;

import com.sandy.agentops.alerting.entity.Anomaly;
import com.sandy.agentops.alerting.entity.AnomalySeverity;
import com.sandy.agentops.alerting.entity.MetricPoint;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares the most recent period of samples with a per-bucket baseline (hour of day, or day and hour of
 * week) learned from the earlier samples. Nothing is flagged until the baseline covers
 * {@link #MIN_CYCLES} full periods.
 */
public class SeasonalAnomalyDetector implements AnomalyDetector {

    public static final int MIN_CYCLES = 2;
    public static final double DEFAULT_THRESHOLD = 3.0;

    public enum Period {
        DAILY(Duration.ofDays(1)),
        WEEKLY(Duration.ofDays(7));

        private final Duration length;

        Period(Duration length) {
            this.length = length;
        }

        public Duration getLength() {
            return length;
        }

        int bucketOf(ZonedDateTime time) {
            return this == DAILY
                    ? time.getHour()
                    : (time.getDayOfWeek().getValue() - 1) * 24 + time.getHour();
        }
    }

    private final Period period;
    private final double threshold;
    private final ZoneId zone;

    public SeasonalAnomalyDetector(Period period, double threshold) {
        this(period, threshold, ZoneOffset.UTC);
    }

    public SeasonalAnomalyDetector(Period period, double threshold, ZoneId zone) {
        if (period == null) throw new IllegalArgumentException("period is required");
        if (zone == null) throw new IllegalArgumentException("zone is required");
        if (threshold <= 0) throw new IllegalArgumentException("threshold must be positive: " + threshold);
        this.period = period;
        this.threshold = threshold;
        this.zone = zone;
    }

    @Override
    public List<Anomaly> detect(List<MetricPoint> points) {
        if (points == null || points.size() < 2) return Collections.emptyList();
        Instant last = points.get(points.size() - 1).getTimestamp();
        Instant evaluationStart = last.minus(period.getLength());
        Instant first = points.get(0).getTimestamp();
        if (Duration.between(first, evaluationStart).compareTo(period.getLength().multipliedBy(MIN_CYCLES)) < 0) {
            return Collections.emptyList();
        }

        Map<Integer, Bucket> baseline = new HashMap<>();
        List<MetricPoint> recent = new ArrayList<>();
        for (MetricPoint p : points) {
            if (p.getTimestamp().isAfter(evaluationStart)) {
                recent.add(p);
            } else {
                baseline.computeIfAbsent(bucketOf(p), k -> new Bucket()).add(p.getValue());
            }
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (MetricPoint p : recent) {
            Bucket bucket = baseline.get(bucketOf(p));
            if (bucket == null || bucket.count < MIN_CYCLES) continue;
            double mean = bucket.mean();
            double std = DetectorMath.floorSpread(bucket.stdDev(), mean);
            double score = Math.abs(p.getValue() - mean) / std;
            if (score > threshold) {
                anomalies.add(Anomaly.builder()
                        .timestamp(p.getTimestamp())
                        .value(p.getValue())
                        .expected(mean)
                        .deviationScore(score)
                        .severity(AnomalySeverity.forScore(score, threshold))
                        .detector(getName())
                        .build());
            }
        }
        return anomalies;
    }

    private int bucketOf(MetricPoint p) {
        return period.bucketOf(p.getTimestamp().atZone(zone));
    }

    /**
     * Baseline cycles, the evaluated period and one spare period. Samples never sit exactly on the window edges,
     * so a window of only {@code MIN_CYCLES + 1} periods always falls short of the baseline requirement.
     */
    @Override
    public Optional<Duration> preferredLookback() {
        return Optional.of(period.getLength().multipliedBy(MIN_CYCLES + 2L));
    }

    public Period getPeriod() {
        return period;
    }

    @Override
    public String getName() {
        return "seasonal-" + period.name().toLowerCase();
    }

    private static class Bucket {
        int count;
        double sum;
        double sumSq;

        void add(double v) {
            count++;
            sum += v;
            sumSq += v * v;
        }

        double mean() {
            return sum / count;
        }

        double stdDev() {
            double m = mean();
            return Math.sqrt(Math.max(0, sumSq / count - m * m));
        }
    }
}
