package com.flamingo.ai.raggateway.transport;

/** Timeout, DNS failure, refused connection or a non-2xx status. */
public class NetworkTransportException extends TransportException {

  private final Integer statusCode;

  public NetworkTransportException(Integer statusCode, String message) {
    super(message, null);
    this.statusCode = statusCode;
  }

  public NetworkTransportException(Integer statusCode, String message, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status when the server answered, {@code null} otherwise. */
  public Integer getStatusCode() {
    return statusCode;
  }

  @Override
  public String getKind() {
    return "NETWORK";
  }
}
