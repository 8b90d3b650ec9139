package com.sandy.agentops.alerting.detector;

import com.sandy.agentops.alerting.entity.Anomaly;
import com.sandy.agentops.alerting.entity.AnomalySeverity;
import com.sandy.agentops.alerting.entity.MetricPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Z-score detector: flags points more than {@code threshold} standard deviations from the window mean.
 */
public class StatisticalAnomalyDetector implements AnomalyDetector {

    public static final double DEFAULT_THRESHOLD = 3.0;
    public static final int DEFAULT_MIN_WINDOW = 30;

    private volatile double threshold;
    private final int minWindow;

    public StatisticalAnomalyDetector() {
        this(DEFAULT_THRESHOLD, DEFAULT_MIN_WINDOW);
    }

    public StatisticalAnomalyDetector(double threshold, int minWindow) {
        if (threshold <= 0) throw new IllegalArgumentException("threshold must be positive: " + threshold);
        if (minWindow < 2) throw new IllegalArgumentException("minWindow must be at least 2: " + minWindow);
        this.threshold = threshold;
        this.minWindow = minWindow;
    }

    @Override
    public List<Anomaly> detect(List<MetricPoint> points) {
        if (points == null || points.size() < minWindow) return Collections.emptyList();
        double thr = threshold;
        double[] values = DetectorMath.values(points);
        double mean = DetectorMath.mean(values);
        double std = DetectorMath.stdDev(values, mean);
        if (std < DetectorMath.MIN_SPREAD) return Collections.emptyList();

        List<Anomaly> anomalies = new ArrayList<>();
        for (MetricPoint p : points) {
            double z = Math.abs(p.getValue() - mean) / std;
            if (z > thr) {
                anomalies.add(Anomaly.builder()
                        .timestamp(p.getTimestamp())
                        .value(p.getValue())
                        .expected(mean)
                        .deviationScore(z)
                        .severity(AnomalySeverity.forScore(z, thr))
                        .detector(getName())
                        .build());
            }
        }
        return anomalies;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        if (threshold <= 0) throw new IllegalArgumentException("threshold must be positive: " + threshold);
        this.threshold = threshold;
    }

    public int getMinWindow() {
        return minWindow;
    }

    @Override
    public String getName() {
        return "statistical";
    }
}
