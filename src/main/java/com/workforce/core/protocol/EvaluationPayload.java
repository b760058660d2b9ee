package com.workforce.core.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decoded body of an {@link MessageKind#EVALUATION} message.
 *
 * @param verdict  PASS or REVISE
 * @param scores   the three 1-5 scores
 * @param feedback reviewer notes; required in practice for REVISE, may be empty on PASS
 */
public record EvaluationPayload(
    Verdict verdict,
    Scores scores,
    String feedback
) {

    /**
     * Reviewer scores, each an integer from 1 to 5.
     */
    public record Scores(
        @JsonProperty("brand_voice") int brandVoice,
        int quality,
        int completion
    ) {}
}
