package com.sandy.agentops.alerting;

import com.sandy.agentops.alerting.entity.MetricPoint;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class MetricFixtures {

    public static final Instant T0 = Instant.parse("2026-01-05T00:00:00Z");

    private MetricFixtures() {}

    public static MetricPoint point(Instant ts, double value) {
        return MetricPoint.builder().timestamp(ts).value(value).build();
    }

    /** {@code count} points one second apart cycling through 100..109. */
    public static List<MetricPoint> sawtooth(Instant start, int count) {
        List<MetricPoint> points = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            points.add(point(start.plusSeconds(i), 100 + (i % 10)));
        }
        return points;
    }

    public static List<MetricPoint> constant(Instant start, Duration step, int count, double value) {
        List<MetricPoint> points = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            points.add(point(start.plus(step.multipliedBy(i)), value));
        }
        return points;
    }
}
