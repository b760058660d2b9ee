package com.workforce.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discriminant of the inter-agent envelope. The router dispatches on this alone.
 */
public enum MessageKind {
    TASK,
    RESULT,
    EVALUATION,
    FEEDBACK;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value.
     *
     * @throws ProtocolException if the kind is absent or unrecognized
     */
    @JsonCreator
    public static MessageKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new ProtocolException("Message kind is missing");
        }
        for (MessageKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        throw new ProtocolException("Unrecognized message kind: " + value);
    }
}
