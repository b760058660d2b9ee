package com.workforce.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of work a run is asked to deliver. Decides whether the evaluation loop applies.
 */
public enum TaskType {
    CONTENT_CREATION,
    RESEARCH,
    ANALYSIS,
    STRATEGY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts both {@code content_creation} and {@code CONTENT_CREATION}; dashes are treated as underscores.
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static TaskType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task type is blank");
        }
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
