package com.flamingo.ai.raggateway.ingestion.model;

/** Classification of a failed {@link ParseAttempt}. */
public enum FailureKind {
  CERTIFICATE_VERIFICATION_FAILED,
  NETWORK,
  NOT_CONFIGURED,
  PARSE_ERROR,
  EMPTY_CONTENT,
  DECODE_ERROR,
  TIMEOUT,
  INTERRUPTED
}
