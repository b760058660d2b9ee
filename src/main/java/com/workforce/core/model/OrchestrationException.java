package com.workforce.core.model;

/**
 * Base for failures that end a run. {@link #errorType()} is the value reported
 * in the {@code error_type} field of the terminal error event.
 */
public abstract class OrchestrationException extends RuntimeException {

    protected OrchestrationException(String message) {
        super(message);
    }

    protected OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String errorType();
}
