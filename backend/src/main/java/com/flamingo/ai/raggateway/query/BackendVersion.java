package com.flamingo.ai.raggateway.query;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flamingo.ai.raggateway.exception.RouterException;
import java.util.Locale;

/** The two interchangeable query-answering backends. */
public enum BackendVersion {
  V1_LOCAL("v1"),
  V2_REMOTE("v2");

  private final String value;

  BackendVersion(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Parses a version string such as {@code "v1"} or {@code "V2"}.
   *
   * @throws RouterException with reason {@code INVALID_VERSION} for anything else
   */
  public static BackendVersion fromValue(String raw) {
    if (raw != null) {
      String normalized = raw.strip().toLowerCase(Locale.ROOT);
      for (BackendVersion version : values()) {
        if (version.value.equals(normalized)) {
          return version;
        }
      }
    }
    throw RouterException.invalidVersion(raw);
  }
}
