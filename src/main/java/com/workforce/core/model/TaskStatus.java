package com.workforce.core.model;

/**
 * Status of the single task a run works on.
 * Moves forward only, except NEEDS_REVISION back to IN_PROGRESS when work is re-delegated.
 */
public enum TaskStatus {
    IN_PROGRESS,
    NEEDS_REVISION,
    DONE
}
