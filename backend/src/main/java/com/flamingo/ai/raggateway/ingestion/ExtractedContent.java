package com.flamingo.ai.raggateway.ingestion;

import com.flamingo.ai.raggateway.ingestion.model.ContentNode;
import java.util.List;

/**
 * What a strategy produced.
 *
 * @param nodes content nodes, never empty
 * @param pageCount page count if known, otherwise {@code null}
 */
public record ExtractedContent(List<ContentNode> nodes, Integer pageCount) {

  public ExtractedContent {
    nodes = List.copyOf(nodes);
  }

  public String text() {
    return String.join("\n\n", nodes.stream().map(ContentNode::text).toList());
  }
}
