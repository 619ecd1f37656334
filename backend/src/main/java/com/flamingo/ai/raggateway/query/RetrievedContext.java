package com.flamingo.ai.raggateway.query;

import java.util.List;

/**
 * Context handed to the local pipeline.
 *
 * @param text concatenated passages, empty when nothing was found
 * @param sources identifiers of the documents the passages came from
 */
public record RetrievedContext(String text, List<String> sources) {

  public static final RetrievedContext EMPTY = new RetrievedContext("", List.of());

  public RetrievedContext {
    text = text == null ? "" : text;
    sources = sources == null ? List.of() : List.copyOf(sources);
  }

  public boolean isEmpty() {
    return text.isBlank();
  }
}
