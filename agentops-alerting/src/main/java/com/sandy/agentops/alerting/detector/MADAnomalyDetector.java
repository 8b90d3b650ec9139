package com.sandy.agentops.alerting.detector;

import com.sandy.agentops.alerting.entity.Anomaly;
import com.sandy.agentops.alerting.entity.AnomalySeverity;
import com.sandy.agentops.alerting.entity.MetricPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Median absolute deviation detector. Median and MAD are barely moved by outliers already in the window,
 * which makes this detector stable on spiky baselines where the z-score one is not.
 */
public class MADAnomalyDetector implements AnomalyDetector {

    /** Scales MAD to the standard deviation of a normal distribution. */
    static final double MAD_SCALE = 1.4826;
    /** Scales mean absolute deviation likewise; used when more than half the window is identical. */
    static final double MEAN_AD_SCALE = 1.2533;

    public static final double DEFAULT_THRESHOLD = 3.0;
    public static final int DEFAULT_MIN_WINDOW = 10;

    private final double threshold;
    private final int minWindow;

    public MADAnomalyDetector() {
        this(DEFAULT_THRESHOLD, DEFAULT_MIN_WINDOW);
    }

    public MADAnomalyDetector(double threshold) {
        this(threshold, DEFAULT_MIN_WINDOW);
    }

    public MADAnomalyDetector(double threshold, int minWindow) {
        if (threshold <= 0) throw new IllegalArgumentException("threshold must be positive: " + threshold);
        if (minWindow < 3) throw new IllegalArgumentException("minWindow must be at least 3: " + minWindow);
        this.threshold = threshold;
        this.minWindow = minWindow;
    }

    @Override
    public List<Anomaly> detect(List<MetricPoint> points) {
        if (points == null || points.size() < minWindow) return Collections.emptyList();
        double[] values = DetectorMath.values(points);
        double median = DetectorMath.median(values);
        double[] absDev = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            absDev[i] = Math.abs(values[i] - median);
        }
        double mad = DetectorMath.median(absDev);
        double spread = mad > 0 ? MAD_SCALE * mad : MEAN_AD_SCALE * DetectorMath.mean(absDev);
        spread = DetectorMath.floorSpread(spread, median);

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double score = absDev[i] / spread;
            if (score > threshold) {
                MetricPoint p = points.get(i);
                anomalies.add(Anomaly.builder()
                        .timestamp(p.getTimestamp())
                        .value(p.getValue())
                        .expected(median)
                        .deviationScore(score)
                        .severity(AnomalySeverity.forScore(score, threshold))
                        .detector(getName())
                        .build());
            }
        }
        return anomalies;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public String getName() {
        return "mad";
    }
}
