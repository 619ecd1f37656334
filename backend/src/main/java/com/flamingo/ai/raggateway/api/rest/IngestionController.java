package com.flamingo.ai.raggateway.api.rest;

import com.flamingo.ai.raggateway.ingestion.IngestionFallbackChain;
import com.flamingo.ai.raggateway.ingestion.model.IngestionResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for turning uploaded files into content. */
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

  private final IngestionFallbackChain ingestionChain;

  /** Ingests an uploaded file. The upload is spooled to a temporary file for the chain. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<IngestionResult> ingest(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "fileId", required = false) String fileId,
      @RequestParam(value = "mimeType", required = false) String mimeType) {
    String id = fileId != null && !fileId.isBlank() ? fileId : UUID.randomUUID().toString();
    String fileName =
        file.getOriginalFilename() != null && !file.getOriginalFilename().isBlank()
            ? file.getOriginalFilename()
            : id;
    String mimeHint = mimeType != null ? mimeType : file.getContentType();

    Path temp = null;
    try {
      temp = Files.createTempFile("rag-ingest-", ".upload");
      file.transferTo(temp);
      return ResponseEntity.ok(ingestionChain.ingest(id, temp, fileName, mimeHint));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to store upload", e);
    } finally {
      deleteQuietly(temp);
    }
  }

  private void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Failed to delete temporary upload {}: {}", temp, e.getMessage());
    }
  }
}
