package com.workforce.core.model;

/**
 * Terminal state of a run. Every run ends in exactly one of COMPLETED, ERRORED or ABORTED.
 */
public enum RunOutcome {
    RUNNING,
    COMPLETED,
    ERRORED,
    ABORTED
}
