package com.flamingo.ai.raggateway.exception;

import com.flamingo.ai.raggateway.query.BackendVersion;

/** Exception thrown when a query cannot be routed or its backend fails. */
public class RouterException extends RuntimeException {

  public enum Reason {
    BACKEND_UNAVAILABLE,
    INVALID_VERSION
  }

  private final Reason reason;
  private final BackendVersion version;
  private final String userMessage;

  private RouterException(
      Reason reason, BackendVersion version, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.version = version;
    this.userMessage = userMessage;
  }

  /**
   * The selected backend failed. {@code classifiedCause} must already be safe to show to users.
   */
  public static RouterException backendUnavailable(
      BackendVersion version, String classifiedCause, Throwable cause) {
    String userMessage =
        "Backend " + version.getValue() + " is unavailable: " + classifiedCause;
    return new RouterException(
        Reason.BACKEND_UNAVAILABLE, version, userMessage, userMessage, cause);
  }

  public static RouterException invalidVersion(String requested) {
    return new RouterException(
        Reason.INVALID_VERSION,
        null,
        "Unknown RAG version: " + requested,
        "Unknown RAG version. Use \"v1\" or \"v2\".",
        null);
  }

  public Reason getReason() {
    return reason;
  }

  /** Backend that failed; {@code null} for {@link Reason#INVALID_VERSION}. */
  public BackendVersion getVersion() {
    return version;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
