package com.flamingo.ai.raggateway.ingestion.model;

import java.util.Map;

/**
 * A unit of extracted content: a page, a section or the whole file.
 *
 * @param text extracted text
 * @param metadata origin details such as {@code page_number}, {@code source} or {@code
 *     section_breadcrumb}
 */
public record ContentNode(String text, Map<String, Object> metadata) {

  public ContentNode {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static ContentNode of(String text) {
    return new ContentNode(text, Map.of());
  }
}
