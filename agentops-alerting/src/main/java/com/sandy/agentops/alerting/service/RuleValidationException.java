package com.sandy.agentops.alerting.service;

/**
 * Thrown when an alert rule is incomplete or uses an unsupported operator. The rule is not registered.
 */
public class RuleValidationException extends RuntimeException {

    public RuleValidationException(String message) {
        super(message);
    }
}
