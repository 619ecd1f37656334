package com.flamingo.ai.raggateway.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of the ingestion audit trail. Created once per strategy tried and never changed.
 *
 * @param strategy the strategy that ran
 * @param outcome success or failure
 * @param failureReason set only on failure
 * @param extractedText text produced on success, {@code null} on failure
 * @param durationMs wall-clock time spent in the strategy
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseAttempt(
    ParseStrategy strategy,
    AttemptOutcome outcome,
    FailureReason failureReason,
    String extractedText,
    long durationMs) {

  public static ParseAttempt success(ParseStrategy strategy, String text, long durationMs) {
    return new ParseAttempt(strategy, AttemptOutcome.SUCCESS, null, text, durationMs);
  }

  public static ParseAttempt failure(
      ParseStrategy strategy, FailureReason reason, long durationMs) {
    return new ParseAttempt(strategy, AttemptOutcome.FAILURE, reason, null, durationMs);
  }

  public boolean succeeded() {
    return outcome == AttemptOutcome.SUCCESS;
  }
}
