package com.workforce.core.state;

import com.workforce.core.protocol.MessageKind;

import java.io.Serializable;

/**
 * A deliverable recorded in a task's artifact ledger.
 *
 * @param key       ledger key, {@code {agentId}_v{iteration}}
 * @param agentId   producing agent
 * @param iteration revision the deliverable was produced in
 * @param kind      kind of the message that carried it
 * @param payload   the deliverable itself
 */
public record ArtifactEntry(
    String key,
    String agentId,
    int iteration,
    MessageKind kind,
    String payload
) implements Serializable {}
