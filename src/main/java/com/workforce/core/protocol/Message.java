package com.workforce.core.protocol;

import java.io.Serializable;

/**
 * The single envelope for all inter-agent traffic.
 * <p>
 * The payload is always a serialized value (plain text or a JSON document). Only the
 * agents exchanging it interpret it; the protocol layer reads it for
 * {@link MessageKind#EVALUATION} messages and nothing else.
 */
public record Message(MessageKind kind, String payload) implements Serializable {

    public Message {
        if (kind == null) {
            throw new ProtocolException("Message kind is missing");
        }
        payload = payload != null ? payload : "";
    }

    public static Message task(String payload) {
        return new Message(MessageKind.TASK, payload);
    }

    public static Message result(String payload) {
        return new Message(MessageKind.RESULT, payload);
    }

    public static Message evaluation(String payload) {
        return new Message(MessageKind.EVALUATION, payload);
    }

    public static Message feedback(String payload) {
        return new Message(MessageKind.FEEDBACK, payload);
    }
}
