package com.sandy.agentops.alerting.action;

import com.sandy.agentops.alerting.entity.AlertAction;
import com.sandy.agentops.alerting.entity.AlertInstance;

/**
 * Delivers a firing alert for one action type. Register implementations as beans; the dispatcher picks them up.
 */
public interface AlertActionHandler {

    /** Action type this handler serves, matched against {@link AlertAction#getType()}. */
    String getType();

    void execute(AlertAction action, AlertInstance alert) throws Exception;
}
