package com.sandy.agentops.alerting.entity;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Action attached to a rule. The config map is passed through untouched to the handler registered for {@code type}.
 */
@Value
@Builder
public class AlertAction {
    String type;
    @Builder.Default
    Map<String, Object> config = Map.of();

    public static AlertAction of(String type) {
        return AlertAction.builder().type(type).build();
    }
}
