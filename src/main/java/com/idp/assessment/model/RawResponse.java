package com.idp.assessment.model;

/**
 * Unparsed answer of the inference service for one task.
 *
 * @param text  response text as returned by the model
 * @param usage token usage of the call that produced it, never {@code null}
 */
public record RawResponse(String text, TokenUsage usage) {

    public RawResponse {
        usage = usage != null ? usage : TokenUsage.NONE;
    }

    public static RawResponse of(String text) {
        return new RawResponse(text, TokenUsage.NONE);
    }
}
