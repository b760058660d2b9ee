package com.workforce.core.model;

import com.workforce.core.protocol.MessageKind;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry of a run's handoff trace: control moved from one agent to another carrying a message.
 *
 * @param from      agent that addressed the message
 * @param to        agent that received control
 * @param kind      kind of the carried message
 * @param timestamp when the hop was recorded
 * @param note      short annotation (artifact key, verdict, revision number); may be empty
 */
public record HandoffStep(
    String from,
    String to,
    MessageKind kind,
    Instant timestamp,
    String note
) implements Serializable {

    public HandoffStep {
        note = note != null ? note : "";
    }
}
