package com.flamingo.ai.raggateway.ingestion.strategy;

import com.flamingo.ai.raggateway.ingestion.ExtractedContent;
import com.flamingo.ai.raggateway.ingestion.IngestionSource;
import com.flamingo.ai.raggateway.ingestion.IngestionStrategy;
import com.flamingo.ai.raggateway.ingestion.StrategyFailedException;
import com.flamingo.ai.raggateway.ingestion.model.ContentNode;
import com.flamingo.ai.raggateway.ingestion.model.FailureKind;
import com.flamingo.ai.raggateway.ingestion.model.ParseStrategy;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Last step of the chain: the file's bytes as strict UTF-8.
 *
 * <p>Any file that decodes as valid UTF-8 succeeds here, including an empty one.
 */
@Component
public class PlainTextStrategy implements IngestionStrategy {

  @Override
  public ParseStrategy kind() {
    return ParseStrategy.PLAIN_TEXT;
  }

  @Override
  public boolean supports(String mimeType) {
    return true;
  }

  @Override
  public ExtractedContent extract(IngestionSource source) throws StrategyFailedException {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(source.path());
    } catch (IOException e) {
      throw new StrategyFailedException(
          FailureKind.DECODE_ERROR, "Failed to read file: " + e.getMessage(), e);
    }

    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      String text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
      return new ExtractedContent(
          List.of(new ContentNode(text, Map.of("source", source.fileName()))), null);
    } catch (CharacterCodingException e) {
      throw new StrategyFailedException(
          FailureKind.DECODE_ERROR, "File is not valid UTF-8 text", e);
    }
  }
}
