package com.flamingo.ai.raggateway.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.raggateway.usage.TokenUsage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.Builder;

/**
 * The answer to one query, in the same shape whichever backend produced it.
 *
 * @param query the question as asked
 * @param organizationId tenant the query ran for
 * @param answerText generated answer
 * @param sources identifiers of the documents the answer drew on, without duplicates
 * @param tokenUsage normalized token counts
 * @param backendVersion backend that answered
 * @param metadata remaining backend fields plus usage flags
 */
@Builder
public record ChatEnvelope(
    String query,
    String organizationId,
    String answerText,
    Set<String> sources,
    @JsonProperty("token_usage") TokenUsage tokenUsage,
    BackendVersion backendVersion,
    Map<String, Object> metadata) {

  public ChatEnvelope {
    sources =
        sources == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(sources));
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
