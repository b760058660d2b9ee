package com.workforce.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Token counters reported by agent turns and accumulated per run.
 */
public record TokenUsage(
    int requests,
    @JsonProperty("input_tokens") long inputTokens,
    @JsonProperty("output_tokens") long outputTokens,
    @JsonProperty("total_tokens") long totalTokens,
    String model
) implements Serializable {

    public static TokenUsage empty() {
        return new TokenUsage(0, 0, 0, 0, null);
    }

    public static TokenUsage of(long inputTokens, long outputTokens, String model) {
        return new TokenUsage(1, inputTokens, outputTokens, inputTokens + outputTokens, model);
    }

    /**
     * Sums the counters. The first model reported wins.
     */
    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(
                requests + other.requests,
                inputTokens + other.inputTokens,
                outputTokens + other.outputTokens,
                totalTokens + other.totalTokens,
                model != null ? model : other.model);
    }
}
