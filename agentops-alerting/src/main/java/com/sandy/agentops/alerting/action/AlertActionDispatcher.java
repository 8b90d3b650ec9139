package com.sandy.agentops.alerting.action;

import com.sandy.agentops.alerting.entity.AlertAction;
import com.sandy.agentops.alerting.entity.AlertInstance;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs a rule's actions in order. A failing or unknown action is logged and skipped; the remaining actions
 * still run and nothing is thrown to the caller.
 */
@Slf4j
public class AlertActionDispatcher {

    private final Map<String, AlertActionHandler> handlers = new ConcurrentHashMap<>();

    public AlertActionDispatcher(List<AlertActionHandler> handlers) {
        handlers.forEach(this::register);
    }

    public void register(AlertActionHandler handler) {
        AlertActionHandler previous = handlers.put(handler.getType(), handler);
        if (previous != null && previous != handler) {
            log.info("Replaced alert action handler type={} previous={} current={}",
                    handler.getType(), previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        }
    }

    /**
     * @return number of actions that failed or had no handler
     */
    public int dispatch(List<AlertAction> actions, AlertInstance alert) {
        if (actions == null || actions.isEmpty()) return 0;
        int failed = 0;
        for (AlertAction action : actions) {
            AlertActionHandler handler = handlers.get(action.getType());
            if (handler == null) {
                log.warn("No handler for alert action type={} alertId={}", action.getType(), alert.getId());
                failed++;
                continue;
            }
            try {
                handler.execute(action, alert);
            } catch (Exception e) {
                failed++;
                log.error("Alert action failed type={} alertId={} ruleId={} error={}",
                        action.getType(), alert.getId(), alert.getRuleId(), e.getMessage(), e);
            }
        }
        return failed;
    }

    public boolean supports(String type) {
        return handlers.containsKey(type);
    }
}
