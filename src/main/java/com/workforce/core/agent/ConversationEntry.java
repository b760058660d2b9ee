package com.workforce.core.agent;

import com.workforce.core.protocol.MessageKind;

import java.io.Serializable;

/**
 * One message delivered during a run, as seen by later agent turns and the conversation artifact.
 */
public record ConversationEntry(
    String from,
    String to,
    MessageKind kind,
    String payload
) implements Serializable {}
