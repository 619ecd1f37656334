package com.flamingo.ai.raggateway.exception;

import com.flamingo.ai.raggateway.ingestion.model.ParseAttempt;
import java.util.List;

/** Exception thrown when no ingestion strategy could extract content from a file. */
public class IngestionException extends RuntimeException {

  public enum Reason {
    ALL_STRATEGIES_EXHAUSTED
  }

  private final Reason reason;
  private final String fileId;
  private final List<ParseAttempt> attempts;
  private final String userMessage;

  public IngestionException(Reason reason, String fileId, List<ParseAttempt> attempts) {
    super("Ingestion failed for file " + fileId + ": " + describe(attempts));
    this.reason = reason;
    this.fileId = fileId;
    this.attempts = List.copyOf(attempts);
    this.userMessage = "The file could not be read by any available parser";
  }

  public Reason getReason() {
    return reason;
  }

  public String getFileId() {
    return fileId;
  }

  public List<ParseAttempt> getAttempts() {
    return attempts;
  }

  public String getUserMessage() {
    return userMessage;
  }

  /** One line per attempt, e.g. {@code PLAIN_TEXT: DECODE_ERROR (File is not valid UTF-8 text)}. */
  public static String describe(List<ParseAttempt> attempts) {
    return String.join(
        "; ",
        attempts.stream().map(a -> a.strategy() + ": " + a.failureReason()).toList());
  }
}
