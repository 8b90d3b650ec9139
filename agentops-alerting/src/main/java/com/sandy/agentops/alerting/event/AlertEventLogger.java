package com.sandy.agentops.alerting.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Log sink for alerting events. Delivery integrations subscribe the same way.
 */
@Component
@Slf4j
public class AlertEventLogger {

    @EventListener
    public void onFiring(AlertFiringEvent event) {
        var a = event.getAlert();
        log.info("[{}] ruleId={} severity={} value={} threshold={} firedAt={}",
                event.topic(), a.getRuleId(), a.getSeverity(), a.getValue(), a.getThreshold(), a.getFiredAt());
    }

    @EventListener
    public void onResolved(AlertResolvedEvent event) {
        var a = event.getAlert();
        log.info("[{}] ruleId={} value={} resolvedAt={}", event.topic(), a.getRuleId(), a.getValue(), a.getResolvedAt());
    }

    @EventListener
    public void onAnomaly(AnomalyDetectedEvent event) {
        var a = event.getAnomaly();
        log.info("[{}] metric={} detector={} severity={} value={} expected={} score={}",
                event.topic(), a.getMetric(), a.getDetector(), a.getSeverity(), a.getValue(), a.getExpected(),
                String.format("%.2f", a.getDeviationScore()));
    }
}
