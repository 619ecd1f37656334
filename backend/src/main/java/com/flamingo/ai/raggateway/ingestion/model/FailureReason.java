package com.flamingo.ai.raggateway.ingestion.model;

/**
 * Why a strategy failed.
 *
 * @param kind classification
 * @param message user-safe description, without URLs or credentials
 */
public record FailureReason(FailureKind kind, String message) {

  @Override
  public String toString() {
    return kind + " (" + message + ")";
  }
}
