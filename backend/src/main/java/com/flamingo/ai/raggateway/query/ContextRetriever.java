package com.flamingo.ai.raggateway.query;

/**
 * Looks up the organization's knowledge relevant to a query. Document storage lives outside this
 * service, so deployments plug in their own implementation.
 */
public interface ContextRetriever {

  RetrievedContext retrieve(String query, String organizationId);
}
