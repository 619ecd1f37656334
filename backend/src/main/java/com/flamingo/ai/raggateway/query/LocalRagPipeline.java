package com.flamingo.ai.raggateway.query;

import java.util.List;
import java.util.Map;

/** The in-process (v1) retrieval and generation backend. */
public interface LocalRagPipeline {

  /**
   * Answers a query for one organization.
   *
   * @return raw response with {@code answer}, {@code sources}, an OpenAI-style {@code usage} map
   *     and any further keys the pipeline wants to expose
   */
  Map<String, Object> answer(
      String query, String organizationId, List<ConversationTurn> conversationHistory);
}
