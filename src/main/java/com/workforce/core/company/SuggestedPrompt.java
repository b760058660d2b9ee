package com.workforce.core.company;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.workforce.core.model.TaskType;

import java.util.List;

/**
 * A ready-made request shown to users, with the agent flow it is expected to produce.
 */
public record SuggestedPrompt(
    String label,
    String prompt,
    String complexity,
    @JsonProperty("task_type") TaskType taskType,
    @JsonProperty("expected_flow") List<String> expectedFlow
) {

    public SuggestedPrompt {
        expectedFlow = expectedFlow != null ? List.copyOf(expectedFlow) : List.of();
    }
}
