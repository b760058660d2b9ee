package com.workforce.core.protocol;

import com.workforce.core.model.OrchestrationException;

/**
 * A message could not be decoded or carried no recognizable kind. Fatal to the run.
 */
public class ProtocolException extends OrchestrationException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorType() {
        return "protocol";
    }
}
