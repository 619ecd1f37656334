package com.flamingo.ai.raggateway.ingestion;

import com.flamingo.ai.raggateway.ingestion.model.ParseStrategy;

/**
 * One step of the ingestion fallback chain.
 *
 * <p>Implementations are stateless and shared across concurrent ingestions.
 */
public interface IngestionStrategy {

  /** Which step of the chain this is; also decides its position. */
  ParseStrategy kind();

  /**
   * Returns {@code true} if this strategy applies to the given MIME type. Strategies that do not
   * apply are skipped without an audit entry.
   */
  boolean supports(String mimeType);

  /**
   * Extracts content from the file.
   *
   * @param source the file and its deadline
   * @return extracted content, never empty
   * @throws StrategyFailedException if nothing usable could be extracted
   */
  ExtractedContent extract(IngestionSource source) throws StrategyFailedException;
}
