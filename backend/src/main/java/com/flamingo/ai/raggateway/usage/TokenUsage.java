package com.flamingo.ai.raggateway.usage;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token counts for one query, in the same shape for every backend.
 *
 * @param inputTokens prompt tokens, never negative
 * @param outputTokens completion tokens, never negative
 * @param totalTokens total as reported by the backend, or input + output when it reported none
 */
public record TokenUsage(
    @JsonProperty("input_tokens") long inputTokens,
    @JsonProperty("output_tokens") long outputTokens,
    @JsonProperty("total_tokens") long totalTokens) {

  public static final TokenUsage ZERO = new TokenUsage(0, 0, 0);
}
