package com.flamingo.ai.raggateway.ingestion;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.springframework.stereotype.Component;

/** Resolves the MIME type of an uploaded file, trusting a specific caller hint over detection. */
@Component
@Slf4j
public class MimeTypeResolver {

  static final String OCTET_STREAM = "application/octet-stream";

  private final Tika tika = new Tika();

  public String resolve(Path file, String fileName, String mimeHint) {
    MediaType hinted = mimeHint != null ? MediaType.parse(mimeHint.strip()) : null;
    if (hinted != null && !OCTET_STREAM.equals(hinted.getBaseType().toString())) {
      return hinted.getBaseType().toString().toLowerCase(Locale.ROOT);
    }
    if (hinted == null && mimeHint != null && !mimeHint.isBlank()) {
      log.debug("Ignoring unparseable MIME hint '{}' for {}", mimeHint, fileName);
    }
    try {
      String detected = tika.detect(file);
      if (OCTET_STREAM.equals(detected) && fileName != null) {
        // magic bytes gave nothing; the extension still might
        detected = tika.detect(fileName);
      }
      log.debug("Detected MIME type {} for {}", detected, fileName);
      return detected;
    } catch (IOException e) {
      log.warn("MIME detection failed for {}: {}", fileName, e.getMessage());
      return OCTET_STREAM;
    }
  }
}
