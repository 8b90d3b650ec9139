package com.sandy.agentops.alerting.service;

import com.sandy.agentops.alerting.entity.MetricPoint;
import com.sandy.agentops.alerting.entity.TimeSeriesQuery;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only store of metric samples. Persistent backends signal an unreachable backend with
 * {@link StorageUnavailableException}.
 */
public interface TimeSeriesStore {

    void write(String metric, double value, Map<String, String> labels, Instant timestamp);

    default void write(String metric, double value, Map<String, String> labels) {
        write(metric, value, labels, null);
    }

    default void write(String metric, double value) {
        write(metric, value, null, null);
    }

    /** Points within {@code [start, end]}, ascending by timestamp. */
    List<MetricPoint> query(TimeSeriesQuery query);

    void clear();
}
