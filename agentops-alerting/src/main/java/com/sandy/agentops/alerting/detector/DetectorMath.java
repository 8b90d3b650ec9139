package com.sandy.agentops.alerting.detector;

import com.sandy.agentops.alerting.entity.MetricPoint;

import java.util.Arrays;
import java.util.List;

final class DetectorMath {

    static final double MIN_SPREAD = 1e-9;
    static final double RELATIVE_SPREAD_FLOOR = 1e-3;

    private DetectorMath() {
    }

    static double[] values(List<MetricPoint> points) {
        double[] v = new double[points.size()];
        for (int i = 0; i < v.length; i++) {
            v[i] = points.get(i).getValue();
        }
        return v;
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return values.length == 0 ? 0 : sum / values.length;
    }

    /** Population standard deviation. */
    static double stdDev(double[] values, double mean) {
        if (values.length == 0) return 0;
        double sq = 0;
        for (double v : values) {
            double d = v - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / values.length);
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        if (n == 0) return 0;
        return n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    /**
     * Keeps a spread estimate away from zero so a perfectly flat baseline still scores a real outlier finitely.
     */
    static double floorSpread(double spread, double baseline) {
        return Math.max(spread, Math.max(MIN_SPREAD, Math.abs(baseline) * RELATIVE_SPREAD_FLOOR));
    }
}
