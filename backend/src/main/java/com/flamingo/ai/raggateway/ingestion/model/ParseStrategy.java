package com.flamingo.ai.raggateway.ingestion.model;

/** Ingestion strategies in the order the fallback chain tries them. */
public enum ParseStrategy {
  PRIMARY_SERVICE,
  ALTERNATE_PARSER,
  PLAIN_TEXT
}
