package com.sandy.agentops.alerting.service;

import com.sandy.agentops.alerting.detector.AnomalyDetector;
import com.sandy.agentops.alerting.detector.CompositeAnomalyDetector;
import com.sandy.agentops.alerting.detector.ExponentialSmoothingDetector;
import com.sandy.agentops.alerting.detector.MADAnomalyDetector;
import com.sandy.agentops.alerting.detector.StatisticalAnomalyDetector;
import com.sandy.agentops.alerting.entity.AlertAction;
import com.sandy.agentops.alerting.entity.AlertInstance;
import com.sandy.agentops.alerting.entity.AlertManagerStats;
import com.sandy.agentops.alerting.entity.AlertRule;
import com.sandy.agentops.alerting.entity.AlertSeverity;
import com.sandy.agentops.alerting.entity.Anomaly;
import com.sandy.agentops.alerting.entity.ComparisonOperator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the alerting core. Owns the rule engine and the anomaly detection service and runs each of them
 * on its own periodic schedule.
 * <p>
 * A tick that arrives while the previous run of the same kind is still in progress is skipped, never overlapped.
 * Stopping cancels future ticks only; pending and firing alerts are kept for the next start.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertManager {

    public static final String METRIC_ERROR_RATE = "agent_error_rate";
    public static final String METRIC_QUEUE_DEPTH = "queue_depth";
    public static final String METRIC_UNHEALTHY_AGENTS = "agents_unhealthy";
    public static final String METRIC_COST_PER_HOUR = "agent_cost_per_hour";

    private final AlertRuleEngine ruleEngine;
    private final AnomalyDetectionService detectionService;
    private final TimeSeriesStore store;
    private final TaskScheduler alertingTaskScheduler;

    @Value("${alerting.evaluation-interval-ms:15000}")
    private long evaluationIntervalMs;
    @Value("${alerting.anomaly-interval-ms:60000}")
    private long anomalyIntervalMs;
    @Value("${alerting.auto-start:true}")
    private boolean autoStart;
    @Value("${alerting.setup-defaults:true}")
    private boolean setupDefaults;

    private final AtomicBoolean evaluationInFlight = new AtomicBoolean(false);
    private final AtomicBoolean detectionInFlight = new AtomicBoolean(false);
    private ScheduledFuture<?> evaluationTask;
    private ScheduledFuture<?> detectionTask;
    private volatile boolean running;

    @PostConstruct
    public void init() {
        if (setupDefaults) {
            setupDefaultRules();
            setupDefaultDetectors();
        }
        log.info("Alert manager initialized: evaluationIntervalMs={} anomalyIntervalMs={} autoStart={} rules={} detectors={}",
                evaluationIntervalMs, anomalyIntervalMs, autoStart, ruleEngine.getRuleCount(), detectionService.getDetectorCount());
        if (autoStart) start();
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    /** Schedules both periodic runs. Calling it while running does nothing. */
    public synchronized void start() {
        if (running) {
            log.debug("Alert manager already running");
            return;
        }
        evaluationTask = alertingTaskScheduler.scheduleAtFixedRate(this::scheduledEvaluation, Duration.ofMillis(evaluationIntervalMs));
        detectionTask = alertingTaskScheduler.scheduleAtFixedRate(this::scheduledDetection, Duration.ofMillis(anomalyIntervalMs));
        running = true;
        log.info("Alert manager started");
    }

    public synchronized void stop() {
        if (!running) return;
        if (evaluationTask != null) evaluationTask.cancel(false);
        if (detectionTask != null) detectionTask.cancel(false);
        evaluationTask = null;
        detectionTask = null;
        running = false;
        log.info("Alert manager stopped. activeAlerts={}", ruleEngine.getActiveAlertCount());
    }

    public boolean isRunning() {
        return running;
    }

    void scheduledEvaluation() {
        if (!evaluationInFlight.compareAndSet(false, true)) {
            log.debug("Skipping rule evaluation tick, previous run still in progress");
            return;
        }
        try {
            ruleEngine.evaluateRules();
        } catch (Exception e) {
            log.error("Scheduled rule evaluation failed: {}", e.getMessage(), e);
        } finally {
            evaluationInFlight.set(false);
        }
    }

    void scheduledDetection() {
        if (!detectionInFlight.compareAndSet(false, true)) {
            log.debug("Skipping anomaly detection tick, previous run still in progress");
            return;
        }
        try {
            detectionService.runDetection();
        } catch (Exception e) {
            log.error("Scheduled anomaly detection failed: {}", e.getMessage(), e);
        } finally {
            detectionInFlight.set(false);
        }
    }

    /** Evaluates all rules now, on the calling thread. Storage errors propagate. */
    public List<AlertInstance> evaluateNow() {
        return ruleEngine.evaluateRules();
    }

    /** Runs anomaly detection now, on the calling thread. Storage errors propagate. */
    public List<Anomaly> detectAnomaliesNow() {
        return detectionService.runDetection();
    }

    public void recordMetric(String metric, double value) {
        store.write(metric, value);
    }

    public void recordMetric(String metric, double value, Map<String, String> labels) {
        store.write(metric, value, labels);
    }

    /**
     * Seeds rules for the signals every orchestrator deployment emits. Thresholds are deployment defaults; replace
     * them with {@link #addRule(AlertRule)} using the same ids.
     */
    public void setupDefaultRules() {
        ruleEngine.addRule(AlertRule.builder()
                .id("high-error-rate")
                .name("High Error Rate")
                .description("More than 10% of agent tasks are failing")
                .severity(AlertSeverity.CRITICAL)
                .metric(METRIC_ERROR_RATE)
                .operator(ComparisonOperator.GREATER_THAN)
                .threshold(0.1)
                .forDuration(Duration.ofMinutes(2))
                .actions(List.of(AlertAction.of("log")))
                .cooldown(Duration.ofMinutes(10))
                .build());
        ruleEngine.addRule(AlertRule.builder()
                .id("queue-backup")
                .name("Queue Backup")
                .description("Pending work is piling up faster than agents drain it")
                .severity(AlertSeverity.WARNING)
                .metric(METRIC_QUEUE_DEPTH)
                .operator(ComparisonOperator.GREATER_THAN)
                .threshold(100)
                .forDuration(Duration.ofMinutes(5))
                .actions(List.of(AlertAction.of("log")))
                .cooldown(Duration.ofMinutes(15))
                .build());
        ruleEngine.addRule(AlertRule.builder()
                .id("agents-unhealthy")
                .name("Agents Unhealthy")
                .description("One or more agents failed their health check")
                .severity(AlertSeverity.CRITICAL)
                .metric(METRIC_UNHEALTHY_AGENTS)
                .operator(ComparisonOperator.GREATER_THAN)
                .threshold(0)
                .forDuration(Duration.ofMinutes(1))
                .actions(List.of(AlertAction.of("log")))
                .cooldown(Duration.ofMinutes(5))
                .build());
        ruleEngine.addRule(AlertRule.builder()
                .id("cost-burn")
                .name("High Cost Burn Rate")
                .description("Agent spend per hour is above the budgeted rate")
                .severity(AlertSeverity.WARNING)
                .metric(METRIC_COST_PER_HOUR)
                .operator(ComparisonOperator.GREATER_THAN)
                .threshold(50)
                .forDuration(Duration.ofMinutes(10))
                .actions(List.of(AlertAction.of("log")))
                .cooldown(Duration.ofMinutes(30))
                .build());
    }

    public void setupDefaultDetectors() {
        detectionService.addDetector(METRIC_ERROR_RATE, new CompositeAnomalyDetector(List.of(
                new StatisticalAnomalyDetector(3.0, 30),
                new MADAnomalyDetector(3.5))));
        detectionService.addDetector(METRIC_QUEUE_DEPTH, new ExponentialSmoothingDetector(0.3, 3.0));
        detectionService.addDetector(METRIC_COST_PER_HOUR, new MADAnomalyDetector(3.0));
    }

    public void addRule(AlertRule rule) {
        ruleEngine.addRule(rule);
    }

    public boolean removeRule(String ruleId) {
        return ruleEngine.removeRule(ruleId);
    }

    public Optional<AlertRule> getRule(String ruleId) {
        return ruleEngine.getRule(ruleId);
    }

    public List<AlertRule> getAllRules() {
        return ruleEngine.getAllRules();
    }

    public int getRuleCount() {
        return ruleEngine.getRuleCount();
    }

    public List<AlertInstance> getActiveAlerts() {
        return ruleEngine.getActiveAlerts();
    }

    public void addDetector(String metric, AnomalyDetector detector) {
        detectionService.addDetector(metric, detector);
    }

    public boolean removeDetector(String metric) {
        return detectionService.removeDetector(metric);
    }

    public int getDetectorCount() {
        return detectionService.getDetectorCount();
    }

    public List<Anomaly> getAnomalyHistory(String metric) {
        return detectionService.getHistory(metric);
    }

    public TimeSeriesStore getStore() {
        return store;
    }

    public AlertManagerStats getStats() {
        return AlertManagerStats.builder()
                .activeAlertCount(ruleEngine.getActiveAlertCount())
                .ruleCount(ruleEngine.getRuleCount())
                .detectorCount(detectionService.getDetectorCount())
                .totalAlertsFired(ruleEngine.getTotalAlertsFired())
                .running(running)
                .build();
    }
}
