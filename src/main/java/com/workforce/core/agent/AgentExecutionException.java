package com.workforce.core.agent;

import com.workforce.core.model.OrchestrationException;

/**
 * An agent turn failed: the model call, a tool or the decision parsing went wrong.
 */
public class AgentExecutionException extends OrchestrationException {

    public AgentExecutionException(String message) {
        super(message);
    }

    public AgentExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "execution";
    }
}
