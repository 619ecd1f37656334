package com.flamingo.ai.raggateway.query;

import lombok.extern.slf4j.Slf4j;

/** Default retriever used when no storage-backed one is registered. */
@Slf4j
public class NoContextRetriever implements ContextRetriever {

  @Override
  public RetrievedContext retrieve(String query, String organizationId) {
    log.debug("No context retriever configured, answering without context");
    return RetrievedContext.EMPTY;
  }
}
