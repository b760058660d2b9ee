package com.workforce.core.routing;

import com.workforce.core.model.OrchestrationException;

/**
 * A handoff broke the route table or the bounce-back rule. Fatal to the run; never corrected.
 */
public class RoutingException extends OrchestrationException {

    public RoutingException(String message) {
        super(message);
    }

    @Override
    public String errorType() {
        return "routing";
    }
}
