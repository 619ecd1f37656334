package com.flamingo.ai.raggateway.ingestion.strategy;

import com.flamingo.ai.raggateway.exception.DocumentParsingException;
import com.flamingo.ai.raggateway.ingestion.ExtractedContent;
import com.flamingo.ai.raggateway.ingestion.IngestionSource;
import com.flamingo.ai.raggateway.ingestion.IngestionStrategy;
import com.flamingo.ai.raggateway.ingestion.StrategyFailedException;
import com.flamingo.ai.raggateway.ingestion.model.FailureKind;
import com.flamingo.ai.raggateway.ingestion.model.ParseStrategy;
import com.flamingo.ai.raggateway.ingestion.parsing.DocumentParser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Second step of the chain: local structural parsing with PDFBox or Tika. */
@Component
@RequiredArgsConstructor
@Slf4j
public class AlternateParserStrategy implements IngestionStrategy {

  private final List<DocumentParser> parsers;

  @Override
  public ParseStrategy kind() {
    return ParseStrategy.ALTERNATE_PARSER;
  }

  @Override
  public boolean supports(String mimeType) {
    return findParser(mimeType).isPresent();
  }

  @Override
  public ExtractedContent extract(IngestionSource source) throws StrategyFailedException {
    DocumentParser parser =
        findParser(source.mimeType())
            .orElseThrow(
                () ->
                    new StrategyFailedException(
                        FailureKind.PARSE_ERROR, "No local parser for " + source.mimeType()));

    log.debug(
        "Parsing file {} locally with {}", source.fileId(), parser.getClass().getSimpleName());
    try (InputStream in = Files.newInputStream(source.path())) {
      ExtractedContent content = parser.parse(in, source.fileName(), source.mimeType());
      if (content.text().isBlank()) {
        throw new StrategyFailedException(FailureKind.EMPTY_CONTENT, "Parser produced no text");
      }
      return content;
    } catch (DocumentParsingException e) {
      throw new StrategyFailedException(FailureKind.PARSE_ERROR, e.getMessage(), e);
    } catch (IOException e) {
      throw new StrategyFailedException(
          FailureKind.PARSE_ERROR, "Failed to read file: " + e.getMessage(), e);
    }
  }

  private Optional<DocumentParser> findParser(String mimeType) {
    return parsers.stream().filter(p -> p.supports(mimeType)).findFirst();
  }
}
