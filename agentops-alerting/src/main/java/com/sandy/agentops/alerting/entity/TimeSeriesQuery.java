package com.sandy.agentops.alerting.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Inclusive time range query over one metric, optionally narrowed to points carrying the given labels.
 */
@Value
@Builder
public class TimeSeriesQuery {
    String metric;
    Instant start;
    Instant end;
    @Builder.Default
    Map<String, String> labels = Map.of();
}
