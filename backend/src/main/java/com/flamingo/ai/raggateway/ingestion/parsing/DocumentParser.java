package com.flamingo.ai.raggateway.ingestion.parsing;

import com.flamingo.ai.raggateway.ingestion.ExtractedContent;
import java.io.InputStream;

/**
 * Local, non-networked structural parser for one family of document formats.
 *
 * <p>Implementations must be stateless so a single instance can serve concurrent ingestions.
 */
public interface DocumentParser {

  /**
   * Parses the given document stream.
   *
   * <p>The caller retains ownership of {@code inputStream}; implementations must not close it.
   *
   * @param inputStream raw document bytes
   * @param fileName original file name, recorded as the {@code source} of each node
   * @param mimeType MIME type of the document
   * @return structured content
   * @throws com.flamingo.ai.raggateway.exception.DocumentParsingException if the document cannot
   *     be read
   */
  ExtractedContent parse(InputStream inputStream, String fileName, String mimeType);

  /** Returns {@code true} if this parser can handle the given MIME type. */
  boolean supports(String mimeType);
}
