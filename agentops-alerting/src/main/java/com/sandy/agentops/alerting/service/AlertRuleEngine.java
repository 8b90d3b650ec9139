package com.sandy.agentops.alerting.service;

import com.sandy.agentops.alerting.action.AlertActionDispatcher;
import com.sandy.agentops.alerting.entity.ActiveAlertState;
import com.sandy.agentops.alerting.entity.AlertAction;
import com.sandy.agentops.alerting.entity.AlertInstance;
import com.sandy.agentops.alerting.entity.AlertRule;
import com.sandy.agentops.alerting.entity.AlertStatus;
import com.sandy.agentops.alerting.entity.MetricPoint;
import com.sandy.agentops.alerting.entity.TimeSeriesQuery;
import com.sandy.agentops.alerting.event.AlertFiringEvent;
import com.sandy.agentops.alerting.event.AlertResolvedEvent;
import com.sandy.agentops.alerting.event.AlertingEvent;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Registry of threshold rules and the per-rule alert state machine.
 * <p>
 * A breach on a rule without state fires at once when {@code for} is zero, otherwise it goes PENDING and fires
 * once the breach has been observed continuously for {@code for}. While FIRING, the alert is re-emitted whenever
 * {@code cooldown} has elapsed since the last emission. The first non-breaching observation clears the state.
 * <p>
 * Rule changes and state reads share the evaluation lock, so they never interleave with a running evaluation.
 */
@Slf4j
public class AlertRuleEngine {

    public static final Duration DEFAULT_MIN_LOOKBACK = Duration.ofSeconds(60);

    private final TimeSeriesStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final AlertActionDispatcher actionDispatcher;
    private final Clock clock;
    private final Duration minLookback;

    private final Map<String, AlertRule> rules = new ConcurrentHashMap<>();
    // ruleId -> state; an entry exists only while the rule is breaching
    private final Map<String, ActiveAlertState> activeStates = new ConcurrentHashMap<>();
    private final AtomicLong totalAlertsFired = new AtomicLong();

    public AlertRuleEngine(TimeSeriesStore store,
                           ApplicationEventPublisher eventPublisher,
                           AlertActionDispatcher actionDispatcher,
                           Clock clock,
                           Duration minLookback) {
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.actionDispatcher = actionDispatcher;
        this.clock = clock;
        this.minLookback = minLookback;
    }

    /**
     * Registers a rule, replacing any rule with the same id. A replaced rule starts over without active state.
     *
     * @throws RuleValidationException if the rule is incomplete; nothing is registered in that case
     */
    public synchronized void addRule(AlertRule rule) {
        validate(rule);
        AlertRule previous = rules.put(rule.getId(), rule);
        if (previous != null) {
            activeStates.remove(rule.getId());
            log.info("Alert rule replaced ruleId={} metric={} {} {}",
                    rule.getId(), rule.getMetric(), rule.getOperator(), rule.getThreshold());
        } else {
            log.info("Alert rule added ruleId={} metric={} {} {} for={} cooldown={}",
                    rule.getId(), rule.getMetric(), rule.getOperator(), rule.getThreshold(),
                    rule.getForDuration(), rule.getCooldown());
        }
    }

    public synchronized boolean removeRule(String ruleId) {
        activeStates.remove(ruleId);
        boolean removed = rules.remove(ruleId) != null;
        if (removed) log.info("Alert rule removed ruleId={}", ruleId);
        return removed;
    }

    public Optional<AlertRule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public List<AlertRule> getAllRules() {
        return List.copyOf(rules.values());
    }

    public int getRuleCount() {
        return rules.size();
    }

    /**
     * Evaluates every enabled rule against the latest sample of its metric.
     * <p>
     * All samples are read before any state changes, so a {@link StorageUnavailableException} leaves every rule's
     * state as it was.
     *
     * @return alerts that fired (or re-fired after cooldown) in this evaluation
     */
    public synchronized List<AlertInstance> evaluateRules() {
        Instant now = clock.instant();
        List<Observation> observations = new ArrayList<>();
        for (AlertRule rule : rules.values()) {
            if (!rule.isEnabled()) continue;
            observations.add(new Observation(rule, latestSample(rule, now)));
        }

        rules.values().stream()
                .filter(r -> !r.isEnabled())
                .forEach(r -> activeStates.remove(r.getId()));

        List<AlertInstance> fired = new ArrayList<>();
        for (Observation o : observations) {
            if (o.getLatest().isEmpty()) continue;
            // a store callback on this thread may have replaced or removed the rule while samples were read
            if (rules.get(o.getRule().getId()) != o.getRule()) continue;
            try {
                evaluate(o.getRule(), o.getLatest().get().getValue(), now).ifPresent(fired::add);
            } catch (RuntimeException e) {
                log.error("Error evaluating rule ruleId={} error={}", o.getRule().getId(), e.getMessage(), e);
            }
        }
        totalAlertsFired.addAndGet(fired.size());
        if (!observations.isEmpty()) {
            log.debug("Rule evaluation completed. rules={} fired={} active={}", observations.size(), fired.size(), activeStates.size());
        }
        return fired;
    }

    private Optional<MetricPoint> latestSample(AlertRule rule, Instant now) {
        Duration lookback = rule.getForDuration().compareTo(minLookback) > 0 ? rule.getForDuration() : minLookback;
        List<MetricPoint> points = store.query(TimeSeriesQuery.builder()
                .metric(rule.getMetric())
                .start(now.minus(lookback))
                .end(now)
                .labels(rule.getLabels())
                .build());
        return points.isEmpty() ? Optional.empty() : Optional.of(points.get(points.size() - 1));
    }

    private Optional<AlertInstance> evaluate(AlertRule rule, double value, Instant now) {
        boolean breach = rule.getOperator().test(value, rule.getThreshold());
        ActiveAlertState state = activeStates.get(rule.getId());

        if (!breach) {
            if (state != null) resolve(rule, state, value, now);
            return Optional.empty();
        }

        if (state == null) {
            state = ActiveAlertState.builder()
                    .ruleId(rule.getId())
                    .status(AlertStatus.PENDING)
                    .firstBreachAt(now)
                    .currentValue(value)
                    .build();
            activeStates.put(rule.getId(), state);
            if (rule.getForDuration().isZero()) {
                return Optional.of(fire(rule, state, now));
            }
            log.debug("Alert pending ruleId={} value={} for={}", rule.getId(), value, rule.getForDuration());
            return Optional.empty();
        }

        state.setCurrentValue(value);
        if (state.getStatus() == AlertStatus.PENDING) {
            if (Duration.between(state.getFirstBreachAt(), now).compareTo(rule.getForDuration()) >= 0) {
                return Optional.of(fire(rule, state, now));
            }
            return Optional.empty();
        }
        if (Duration.between(state.getLastFiredAt(), now).compareTo(rule.getCooldown()) >= 0) {
            return Optional.of(fire(rule, state, now));
        }
        return Optional.empty();
    }

    private AlertInstance fire(AlertRule rule, ActiveAlertState state, Instant now) {
        state.setStatus(AlertStatus.FIRING);
        state.setLastFiredAt(now);
        AlertInstance alert = toInstance(rule, state).toBuilder().firedAt(now).build();
        log.info("Alert firing ruleId={} severity={} value={} threshold={}",
                rule.getId(), rule.getSeverity(), state.getCurrentValue(), rule.getThreshold());
        actionDispatcher.dispatch(rule.getActions(), alert);
        publish(new AlertFiringEvent(alert));
        return alert;
    }

    private void resolve(AlertRule rule, ActiveAlertState state, double value, Instant now) {
        activeStates.remove(rule.getId());
        if (state.getStatus() != AlertStatus.FIRING) {
            log.debug("Pending alert cleared ruleId={} value={}", rule.getId(), value);
            return;
        }
        state.setCurrentValue(value);
        AlertInstance resolved = toInstance(rule, state).toBuilder()
                .status(AlertStatus.RESOLVED)
                .firedAt(state.getLastFiredAt())
                .resolvedAt(now)
                .build();
        log.info("Alert resolved ruleId={} value={}", rule.getId(), value);
        publish(new AlertResolvedEvent(resolved));
    }

    private void publish(AlertingEvent event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Event subscriber failed topic={} error={}", event.topic(), e.getMessage(), e);
        }
    }

    /** Alerts currently pending or firing. */
    public synchronized List<AlertInstance> getActiveAlerts() {
        List<AlertInstance> result = new ArrayList<>();
        for (ActiveAlertState state : activeStates.values()) {
            AlertRule rule = rules.get(state.getRuleId());
            if (rule != null) result.add(toInstance(rule, state));
        }
        return result;
    }

    public synchronized Optional<AlertInstance> getActiveAlert(String ruleId) {
        ActiveAlertState state = activeStates.get(ruleId);
        AlertRule rule = rules.get(ruleId);
        if (state == null || rule == null) return Optional.empty();
        return Optional.of(toInstance(rule, state));
    }

    public int getActiveAlertCount() {
        return activeStates.size();
    }

    /** Drops all pending and firing state without publishing resolutions. */
    public synchronized void clearActiveAlerts() {
        activeStates.clear();
    }

    public long getTotalAlertsFired() {
        return totalAlertsFired.get();
    }

    private AlertInstance toInstance(AlertRule rule, ActiveAlertState state) {
        return AlertInstance.builder()
                .id(alertId(rule))
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .metric(rule.getMetric())
                .severity(rule.getSeverity())
                .status(state.getStatus())
                .startedAt(state.getFirstBreachAt())
                .firedAt(state.getLastFiredAt())
                .value(state.getCurrentValue())
                .threshold(rule.getThreshold())
                .operator(rule.getOperator())
                .message(String.format(Locale.ROOT, "%s: %s is %.2f (%s %s)",
                        rule.getName(), rule.getMetric(), state.getCurrentValue(), rule.getOperator().getSymbol(),
                        rule.getThreshold()))
                .labels(rule.getLabels())
                .build();
    }

    private static String alertId(AlertRule rule) {
        if (rule.getLabels().isEmpty()) return rule.getId();
        return rule.getId() + new TreeMap<>(rule.getLabels()).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    }

    static void validate(AlertRule rule) {
        if (rule == null) throw new RuleValidationException("rule is required");
        requireText(rule.getId(), "id");
        requireText(rule.getName(), "name", rule.getId());
        requireText(rule.getMetric(), "metric", rule.getId());
        if (rule.getSeverity() == null) throw new RuleValidationException("Rule " + rule.getId() + ": severity is required");
        if (rule.getOperator() == null) throw new RuleValidationException("Rule " + rule.getId() + ": operator is required");
        if (!Double.isFinite(rule.getThreshold())) {
            throw new RuleValidationException("Rule " + rule.getId() + ": threshold must be a finite number");
        }
        requireNonNegative(rule.getForDuration(), "for", rule.getId());
        requireNonNegative(rule.getCooldown(), "cooldown", rule.getId());
        if (rule.getLabels() == null) throw new RuleValidationException("Rule " + rule.getId() + ": labels must not be null");
        if (rule.getActions() == null) throw new RuleValidationException("Rule " + rule.getId() + ": actions must not be null");
        for (AlertAction action : rule.getActions()) {
            if (action == null || action.getType() == null || action.getType().isBlank()) {
                throw new RuleValidationException("Rule " + rule.getId() + ": every action needs a type");
            }
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) throw new RuleValidationException("Rule " + field + " is required");
    }

    private static void requireText(String value, String field, String ruleId) {
        if (value == null || value.isBlank()) throw new RuleValidationException("Rule " + ruleId + ": " + field + " is required");
    }

    private static void requireNonNegative(Duration d, String field, String ruleId) {
        if (d == null || d.isNegative()) {
            throw new RuleValidationException("Rule " + ruleId + ": " + field + " must be zero or positive");
        }
    }

    @Value
    private static class Observation {
        AlertRule rule;
        Optional<MetricPoint> latest;
    }
}
