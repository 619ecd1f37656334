package com.flamingo.ai.raggateway.ingestion.llamaparse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import com.flamingo.ai.raggateway.ingestion.ExtractedContent;
import com.flamingo.ai.raggateway.ingestion.IngestionSource;
import com.flamingo.ai.raggateway.ingestion.model.ContentNode;
import com.flamingo.ai.raggateway.transport.CertificateMode;
import com.flamingo.ai.raggateway.transport.RawBody;
import com.flamingo.ai.raggateway.transport.SecureHttpTransport;
import com.flamingo.ai.raggateway.transport.TransportRequest;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;

/**
 * Client for a LlamaParse-compatible cloud parsing API.
 *
 * <p>A parse is a job: upload the file, poll the job until it finishes, then fetch the JSON result
 * with one entry per page. Every call of one parse runs under the same {@link CertificateMode}.
 */
@Component
@Slf4j
public class ParsingServiceClient {

  static final String UPLOAD_PATH = "/api/parsing/upload";
  static final String JOB_PATH = "/api/parsing/job/";

  private final SecureHttpTransport transport;
  private final ObjectMapper objectMapper;
  private final RagGatewayConfig.ParsingService settings;
  private final long pollIntervalMs;

  public ParsingServiceClient(
      SecureHttpTransport transport, ObjectMapper objectMapper, RagGatewayConfig ragGatewayConfig) {
    this.transport = transport;
    this.objectMapper = objectMapper;
    this.settings = ragGatewayConfig.getParsingService();
    this.pollIntervalMs = ragGatewayConfig.getIngestion().getPollIntervalMs();
  }

  /** Returns {@code true} when an API key is configured. */
  public boolean isConfigured() {
    return settings.getApiKey() != null && !settings.getApiKey().isBlank();
  }

  /**
   * Parses the file remotely.
   *
   * @param source file to parse and its deadline
   * @param mode certificate mode for every call of this parse
   * @return one node per non-empty page, with the page count reported by the service
   * @throws com.flamingo.ai.raggateway.transport.TransportException on TLS or network failures
   * @throws ParsingJobException if the job fails, times out or returns an unreadable result
   * @throws InterruptedException if interrupted while waiting between polls
   */
  public ExtractedContent parse(IngestionSource source, CertificateMode mode)
      throws InterruptedException {
    String jobId = upload(source, mode);
    log.debug("Parsing job {} created for file {}", jobId, source.fileId());

    awaitCompletion(jobId, source, mode);

    RawBody result =
        transport.fetch(
            TransportRequest.get(
                uri(JOB_PATH + jobId + "/result/json"), authHeaders(), callTimeout(source)),
            mode);
    return toContent(readJson(result.body()), source.fileName());
  }

  private String upload(IngestionSource source, CertificateMode mode) {
    MultipartBodyBuilder parts = new MultipartBodyBuilder();
    parts
        .part("file", new FileSystemResource(source.path()))
        .filename(source.fileName())
        .contentType(uploadContentType(source.mimeType()));
    parts.part("language", settings.getLanguage());
    parts.part("result_type", settings.getResultType());

    RawBody body =
        transport.fetch(
            TransportRequest.postMultipart(
                uri(UPLOAD_PATH), authHeaders(), parts.build(), callTimeout(source)),
            mode);
    String jobId = readJson(body.body()).path("id").asText("");
    if (jobId.isBlank()) {
      throw new ParsingJobException("Parsing service did not return a job id");
    }
    return jobId;
  }

  private void awaitCompletion(String jobId, IngestionSource source, CertificateMode mode)
      throws InterruptedException {
    while (true) {
      if (source.expired()) {
        throw ParsingJobException.deadlineExceeded();
      }
      RawBody body =
          transport.fetch(
              TransportRequest.get(uri(JOB_PATH + jobId), authHeaders(), callTimeout(source)),
              mode);
      String status = readJson(body.body()).path("status").asText("").toUpperCase(Locale.ROOT);
      switch (status) {
        case "SUCCESS":
          return;
        case "ERROR":
        case "CANCELED":
        case "CANCELLED":
          throw new ParsingJobException("Parsing job ended with status " + status);
        default:
          log.trace("Parsing job {} status {}", jobId, status);
          Thread.sleep(Math.min(pollIntervalMs, Math.max(source.remaining().toMillis(), 1)));
      }
    }
  }

  /**
   * Converts the job result into content nodes.
   *
   * <p>Page text prefers markdown over plain text. The page count comes from the job metadata,
   * except when the service reports 0 or nothing (cache hits do) while pages were returned.
   */
  ExtractedContent toContent(JsonNode result, String fileName) {
    JsonNode document = result.isArray() ? result.path(0) : result;
    JsonNode pages = document.path("pages");

    List<ContentNode> nodes = new ArrayList<>();
    for (int i = 0; i < pages.size(); i++) {
      JsonNode page = pages.get(i);
      String text = page.path("md").asText("");
      if (text.isBlank()) {
        text = page.path("text").asText("");
      }
      if (text.isBlank()) {
        continue;
      }
      int pageNumber = page.path("page").asInt(i + 1);
      nodes.add(
          new ContentNode(text, Map.of("page_number", pageNumber, "source", fileName)));
    }

    JsonNode jobMetadata = document.path("job_metadata");
    Integer pageCount =
        jobMetadata.hasNonNull("job_pages") ? jobMetadata.get("job_pages").asInt() : null;
    if ((pageCount == null || pageCount == 0) && pages.size() > 0) {
      pageCount = pages.size();
    }
    log.debug(
        "Parsing result: job_pages={}, pages array={}, cache hit={}",
        jobMetadata.path("job_pages").asText("n/a"),
        pages.size(),
        jobMetadata.path("job_is_cache_hit").asBoolean(false));

    if (nodes.isEmpty()) {
      throw new ParsingJobException("Parsing service returned no text");
    }
    return new ExtractedContent(nodes, pageCount);
  }

  private JsonNode readJson(String body) {
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new ParsingJobException("Parsing service returned malformed JSON", e);
    }
  }

  private HttpHeaders authHeaders() {
    HttpHeaders headers = new HttpHeaders();
    headers.setBearerAuth(settings.getApiKey());
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    return headers;
  }

  private URI uri(String path) {
    return URI.create(stripTrailingSlash(settings.getBaseUrl()) + path);
  }

  private Duration callTimeout(IngestionSource source) {
    Duration remaining = source.remaining();
    if (remaining.isZero()) {
      throw ParsingJobException.deadlineExceeded();
    }
    return remaining;
  }

  private static MediaType uploadContentType(String mimeType) {
    try {
      return MediaType.parseMediaType(mimeType);
    } catch (InvalidMediaTypeException e) {
      log.debug("Uploading with octet-stream instead of unparseable type {}", mimeType);
      return MediaType.APPLICATION_OCTET_STREAM;
    }
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
