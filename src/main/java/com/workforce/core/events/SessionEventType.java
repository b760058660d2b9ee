package com.workforce.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Element types of a run's event stream.
 */
public enum SessionEventType {
    START,
    AGENT_CHANGE,
    TOOL_CALL,
    TOOL_RESULT,
    DELTA,
    COMPLETE,
    ARTIFACTS_SAVED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** {@code complete} and {@code error} end a stream; nothing follows them. */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    public static SessionEventType fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
