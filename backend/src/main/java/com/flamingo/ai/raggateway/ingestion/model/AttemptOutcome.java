package com.flamingo.ai.raggateway.ingestion.model;

/** Outcome of a single {@link ParseAttempt}. */
public enum AttemptOutcome {
  SUCCESS,
  FAILURE
}
