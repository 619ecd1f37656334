package com.flamingo.ai.raggateway.ingestion.llamaparse;

/** The parsing service answered, but the job did not yield usable content. */
public class ParsingJobException extends RuntimeException {

  private final boolean deadlineExceeded;

  public ParsingJobException(String message) {
    this(message, null, false);
  }

  public ParsingJobException(String message, Throwable cause) {
    this(message, cause, false);
  }

  private ParsingJobException(String message, Throwable cause, boolean deadlineExceeded) {
    super(message, cause);
    this.deadlineExceeded = deadlineExceeded;
  }

  static ParsingJobException deadlineExceeded() {
    return new ParsingJobException(
        "Parsing job did not finish before the ingestion deadline", null, true);
  }

  public boolean isDeadlineExceeded() {
    return deadlineExceeded;
  }
}
