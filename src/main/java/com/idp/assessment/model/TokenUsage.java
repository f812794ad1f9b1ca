package com.idp.assessment.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token counts reported by the inference service for one or more calls.
 */
public record TokenUsage(
        @JsonProperty("input_tokens") long inputTokens,
        @JsonProperty("output_tokens") long outputTokens
) {

    public static final TokenUsage NONE = new TokenUsage(0, 0);

    @JsonProperty("total_tokens")
    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    public TokenUsage plus(TokenUsage other) {
        if (other == null) {
            return this;
        }
        return new TokenUsage(inputTokens + other.inputTokens, outputTokens + other.outputTokens);
    }
}
