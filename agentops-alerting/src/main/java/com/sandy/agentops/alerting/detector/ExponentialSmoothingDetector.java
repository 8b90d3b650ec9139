package com.sandy.agentops.alerting.detector;

import com.sandy.agentops.alerting.entity.Anomaly;
import com.sandy.agentops.alerting.entity.AnomalySeverity;
import com.sandy.agentops.alerting.entity.MetricPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Simple exponential smoothing forecaster. The whole sequence is replayed on each call; a point is flagged
 * when its residual against the running forecast exceeds {@code threshold} running residual deviations.
 * Each point is tested before it updates the forecast and the residual variance.
 */
public class ExponentialSmoothingDetector implements AnomalyDetector {

    public static final double DEFAULT_ALPHA = 0.3;
    public static final double DEFAULT_THRESHOLD = 3.0;
    public static final int DEFAULT_WARM_UP = 10;

    private final double alpha;
    private final double threshold;
    private final int warmUp;

    public ExponentialSmoothingDetector() {
        this(DEFAULT_ALPHA, DEFAULT_THRESHOLD, DEFAULT_WARM_UP);
    }

    public ExponentialSmoothingDetector(double alpha, double threshold) {
        this(alpha, threshold, DEFAULT_WARM_UP);
    }

    public ExponentialSmoothingDetector(double alpha, double threshold, int warmUp) {
        if (!(alpha > 0 && alpha < 1)) throw new IllegalArgumentException("alpha must be in (0,1): " + alpha);
        if (threshold <= 0) throw new IllegalArgumentException("threshold must be positive: " + threshold);
        if (warmUp < 1) throw new IllegalArgumentException("warmUp must be positive: " + warmUp);
        this.alpha = alpha;
        this.threshold = threshold;
        this.warmUp = warmUp;
    }

    @Override
    public List<Anomaly> detect(List<MetricPoint> points) {
        if (points == null || points.size() <= warmUp) return Collections.emptyList();

        List<Anomaly> anomalies = new ArrayList<>();
        double forecast = points.get(0).getValue();
        double variance = 0;
        for (int i = 1; i < points.size(); i++) {
            MetricPoint p = points.get(i);
            double residual = p.getValue() - forecast;
            if (i >= warmUp) {
                double std = DetectorMath.floorSpread(Math.sqrt(variance), forecast);
                double score = Math.abs(residual) / std;
                if (score > threshold) {
                    anomalies.add(Anomaly.builder()
                            .timestamp(p.getTimestamp())
                            .value(p.getValue())
                            .expected(forecast)
                            .deviationScore(score)
                            .severity(AnomalySeverity.forScore(score, threshold))
                            .detector(getName())
                            .build());
                }
            }
            variance = (1 - alpha) * variance + alpha * residual * residual;
            forecast = forecast + alpha * residual;
        }
        return anomalies;
    }

    public double getAlpha() {
        return alpha;
    }

    @Override
    public String getName() {
        return "exponential-smoothing";
    }
}
