package com.flamingo.ai.raggateway.transport;

/**
 * Classified failure of an outbound call. Messages are safe to show to users: they never contain
 * the request URL or credentials.
 */
public abstract class TransportException extends RuntimeException {

  protected TransportException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Short machine-readable classification, e.g. {@code CERTIFICATE_VERIFICATION_FAILED}. */
  public abstract String getKind();
}
