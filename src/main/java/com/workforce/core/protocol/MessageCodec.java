package com.workforce.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;

/**
 * Encodes structured values into self-contained message payloads and decodes the
 * payloads the protocol layer itself needs to read.
 * <p>
 * Every payload is a string so that a strict-schema execution substrate can carry it
 * without knowing its shape.
 */
public class MessageCodec {

    private static final int MIN_SCORE = 1;
    private static final int MAX_SCORE = 5;

    private final ObjectMapper objectMapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Serializes {@code value} to a JSON string. Strings are passed through untouched.
     *
     * @throws ProtocolException if the value cannot be serialized
     */
    public String encode(Object value) {
        if (value instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Payload could not be encoded: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Builds a message from a raw kind string and payload, as received from an agent.
     *
     * @throws ProtocolException if the kind is absent or unrecognized
     */
    public Message message(String rawKind, String payload) {
        return new Message(MessageKind.fromWire(rawKind), payload);
    }

    /**
     * Decodes a JSON payload into {@code type}.
     *
     * @throws ProtocolException if the payload is not valid JSON for the type
     */
    public <T> T decode(String payload, Class<T> type) {
        if (payload == null || payload.isBlank()) {
            throw new ProtocolException("Empty payload where " + type.getSimpleName() + " was expected");
        }
        try {
            return objectMapper.readValue(stripFences(payload), type);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Payload is not a valid " + type.getSimpleName() + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads the verdict, scores and feedback of an evaluation message.
     * Only these fields are inspected; anything else in the payload is ignored.
     *
     * @throws ProtocolException if the message is not an evaluation, or any required field is missing or out of range
     */
    public EvaluationPayload decodeEvaluation(Message message) {
        if (message.kind() != MessageKind.EVALUATION) {
            throw new ProtocolException("Expected an evaluation message but got " + message.kind().wireName());
        }
        JsonNode root = decode(message.payload(), JsonNode.class);
        if (!root.isObject()) {
            throw new ProtocolException("Evaluation payload must be a JSON object");
        }

        String rawVerdict = root.path("verdict").asText("");
        Verdict verdict;
        try {
            verdict = Verdict.valueOf(rawVerdict.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Evaluation verdict must be PASS or REVISE, got '" + rawVerdict + "'", e);
        }

        JsonNode scores = root.path("scores");
        if (!scores.isObject()) {
            throw new ProtocolException("Evaluation payload has no scores object");
        }
        var decodedScores = new EvaluationPayload.Scores(
                score(scores, "brand_voice"),
                score(scores, "quality"),
                score(scores, "completion"));

        String feedback = root.path("feedback").asText("");
        return new EvaluationPayload(verdict, decodedScores, feedback);
    }

    private static int score(JsonNode scores, String field) {
        JsonNode node = scores.get(field);
        if (node == null || !node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ProtocolException("Evaluation score '" + field + "' is missing or not an integer");
        }
        int value = node.intValue();
        if (value < MIN_SCORE || value > MAX_SCORE) {
            throw new ProtocolException("Evaluation score '" + field + "' must be between "
                    + MIN_SCORE + " and " + MAX_SCORE + ", got " + value);
        }
        return value;
    }

    /** Models often wrap JSON in markdown fences. */
    private static String stripFences(String payload) {
        String cleaned = payload.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
