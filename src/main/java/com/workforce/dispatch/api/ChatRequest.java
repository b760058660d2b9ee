package com.workforce.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for the chat endpoints.
 *
 * @param message  the user's goal
 * @param stream   true for a {@code text/event-stream} of session events
 * @param taskType optional task type; classified from the message when absent
 */
public record ChatRequest(
    String message,
    Boolean stream,
    @JsonProperty("task_type") String taskType
) {

    public boolean isStream() {
        return Boolean.TRUE.equals(stream);
    }
}
