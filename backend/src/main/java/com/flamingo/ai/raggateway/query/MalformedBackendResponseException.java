package com.flamingo.ai.raggateway.query;

/** The backend answered 2xx, but with a body that is not a JSON object. */
public class MalformedBackendResponseException extends RuntimeException {

  public MalformedBackendResponseException(String message) {
    super(message);
  }

  public MalformedBackendResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
