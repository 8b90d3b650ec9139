package com.sandy.agentops.alerting.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.agentops.alerting.action.AlertActionDispatcher;
import com.sandy.agentops.alerting.action.AlertActionHandler;
import com.sandy.agentops.alerting.action.LogAlertActionHandler;
import com.sandy.agentops.alerting.service.AlertRuleEngine;
import com.sandy.agentops.alerting.service.AnomalyDetectionService;
import com.sandy.agentops.alerting.service.TimeSeriesStore;
import com.sandy.agentops.alerting.service.impl.InMemoryTimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the alerting core. The in-memory {@link TimeSeriesStore} is registered while {@code alerting.store.type}
 * is {@code memory} (the default); any other value expects the application to provide its own store bean.
 */
@Configuration
@Slf4j
public class AlertingConfig {

    @Bean
    public Clock alertingClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "alerting.store.type", havingValue = "memory", matchIfMissing = true)
    public TimeSeriesStore timeSeriesStore(Clock clock,
                                           @Value("${alerting.store.max-points-per-series:10000}") int maxPointsPerSeries) {
        log.info("Using in-memory time series store maxPointsPerSeries={}", maxPointsPerSeries);
        return new InMemoryTimeSeriesStore(clock, maxPointsPerSeries);
    }

    @Bean
    public LogAlertActionHandler logAlertActionHandler(ObjectMapper objectMapper) {
        return new LogAlertActionHandler(objectMapper);
    }

    @Bean
    public AlertActionDispatcher alertActionDispatcher(List<AlertActionHandler> handlers) {
        return new AlertActionDispatcher(handlers);
    }

    @Bean
    public AlertRuleEngine alertRuleEngine(TimeSeriesStore store,
                                           ApplicationEventPublisher eventPublisher,
                                           AlertActionDispatcher actionDispatcher,
                                           Clock clock,
                                           @Value("${alerting.rule-lookback-ms:60000}") long ruleLookbackMs) {
        return new AlertRuleEngine(store, eventPublisher, actionDispatcher, clock, Duration.ofMillis(ruleLookbackMs));
    }

    @Bean
    public AnomalyDetectionService anomalyDetectionService(TimeSeriesStore store,
                                                           ApplicationEventPublisher eventPublisher,
                                                           Clock clock,
                                                           @Value("${alerting.anomaly.lookback-ms:3600000}") long lookbackMs,
                                                           @Value("${alerting.anomaly.max-history-per-metric:1000}") int maxHistory) {
        return new AnomalyDetectionService(store, eventPublisher, clock, Duration.ofMillis(lookbackMs), maxHistory);
    }

    /** Two threads: evaluation and detection tick independently. */
    @Bean
    public ThreadPoolTaskScheduler alertingTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("alerting-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
