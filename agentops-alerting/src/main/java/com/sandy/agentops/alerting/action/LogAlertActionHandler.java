package com.sandy.agentops.alerting.action;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.agentops.alerting.entity.AlertAction;
import com.sandy.agentops.alerting.entity.AlertInstance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Built-in {@code log} action. Writes the alert as JSON at the level named by the optional {@code level}
 * config entry (warn by default).
 */
@Slf4j
@RequiredArgsConstructor
public class LogAlertActionHandler implements AlertActionHandler {

    public static final String TYPE = "log";
    private static final int MAX_PAYLOAD_CHARS = 2000;

    private final ObjectMapper objectMapper;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public void execute(AlertAction action, AlertInstance alert) {
        Object level = action.getConfig().getOrDefault("level", "warn");
        String payload = toJson(alert);
        switch (String.valueOf(level).toLowerCase()) {
            case "info" -> log.info("Alert triggered: {} payload={}", alert.getMessage(), payload);
            case "error" -> log.error("Alert triggered: {} payload={}", alert.getMessage(), payload);
            default -> log.warn("Alert triggered: {} payload={}", alert.getMessage(), payload);
        }
    }

    private String toJson(Object obj) {
        try {
            String s = objectMapper.writeValueAsString(obj);
            if (s.length() > MAX_PAYLOAD_CHARS) {
                return s.substring(0, MAX_PAYLOAD_CHARS) + "...(" + (s.length() - MAX_PAYLOAD_CHARS) + " more chars)";
            }
            return s;
        } catch (Exception e) {
            return String.valueOf(obj);
        }
    }
}
