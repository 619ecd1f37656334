package com.flamingo.ai.raggateway.ingestion.model;

import java.util.List;

/**
 * Outcome of a successful ingestion. Its content always comes from the single successful attempt,
 * which is the last entry of {@code attempts}.
 *
 * @param fileId caller-supplied or generated file identifier
 * @param finalStrategyUsed the strategy that produced {@code content}
 * @param content extracted content nodes
 * @param pageCount page count when the producing strategy knows it, otherwise {@code null}
 * @param attempts ordered audit trail of every strategy tried
 */
public record IngestionResult(
    String fileId,
    ParseStrategy finalStrategyUsed,
    List<ContentNode> content,
    Integer pageCount,
    List<ParseAttempt> attempts) {

  public IngestionResult {
    content = List.copyOf(content);
    attempts = List.copyOf(attempts);
  }

  /** All content joined with blank lines, as stored for retrieval. */
  public String fullText() {
    return String.join("\n\n", content.stream().map(ContentNode::text).toList());
  }
}
