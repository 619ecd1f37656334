package com.flamingo.ai.raggateway.ingestion;

import com.flamingo.ai.raggateway.ingestion.model.FailureKind;
import com.flamingo.ai.raggateway.ingestion.model.FailureReason;

/** Thrown by an {@link IngestionStrategy} that could not extract content. */
public class StrategyFailedException extends Exception {

  private final transient FailureReason reason;

  public StrategyFailedException(FailureKind kind, String message) {
    super(message);
    this.reason = new FailureReason(kind, message);
  }

  public StrategyFailedException(FailureKind kind, String message, Throwable cause) {
    super(message, cause);
    this.reason = new FailureReason(kind, message);
  }

  public FailureReason getReason() {
    return reason;
  }
}
