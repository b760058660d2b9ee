package com.workforce.core.artifacts;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Listing entry for a stored run.
 *
 * @param runId    run id (directory name)
 * @param input    first line of the goal, if recorded
 * @param outcome  outcome from {@code trace.json}, or "unknown" while running or after a crash
 * @param path     absolute directory path
 */
public record RunSummary(
    @JsonProperty("run_id") String runId,
    String input,
    String outcome,
    String path
) {}
