package com.flamingo.ai.raggateway.ingestion.llamaparse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import com.flamingo.ai.raggateway.ingestion.ExtractedContent;
import com.flamingo.ai.raggateway.ingestion.IngestionSource;
import com.flamingo.ai.raggateway.transport.CertificateMode;
import com.flamingo.ai.raggateway.transport.RawBody;
import com.flamingo.ai.raggateway.transport.SecureHttpTransport;
import com.flamingo.ai.raggateway.transport.TransportRequest;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

@ExtendWith(MockitoExtension.class)
@DisplayName("ParsingServiceClient Tests")
class ParsingServiceClientTest {

  private static final String BASE = "https://parse.example.com";

  @Mock private SecureHttpTransport transport;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private ParsingServiceClient client;
  private IngestionSource source;

  @BeforeEach
  void setUp() {
    RagGatewayConfig config = new RagGatewayConfig();
    config.getParsingService().setBaseUrl(BASE + "/");
    config.getParsingService().setApiKey("llx-test");
    config.getIngestion().setPollIntervalMs(1);
    client = new ParsingServiceClient(transport, objectMapper, config);
    source =
        new IngestionSource(
            "file-1",
            Path.of("report.pdf"),
            "report.pdf",
            "application/pdf",
            Instant.now().plusSeconds(30));
  }

  @Nested
  @DisplayName("Job protocol")
  class JobProtocol {

    @Test
    @DisplayName("Should upload, poll until SUCCESS and read the JSON result")
    void shouldRunFullJob() throws Exception {
      List<TransportRequest> seen = new ArrayList<>();
      List<String> statuses = new ArrayList<>(List.of("PENDING", "SUCCESS"));
      when(transport.fetch(any(TransportRequest.class), eq(CertificateMode.STRICT)))
          .thenAnswer(
              invocation -> {
                TransportRequest request = invocation.getArgument(0);
                seen.add(request);
                String path = request.uri().getPath();
                if (path.equals(ParsingServiceClient.UPLOAD_PATH)) {
                  return new RawBody(200, "{\"id\":\"job-1\",\"status\":\"PENDING\"}");
                }
                if (path.endsWith("/result/json")) {
                  return new RawBody(
                      200,
                      "{\"pages\":[{\"page\":1,\"md\":\"# Intro\",\"text\":\"Intro\"},"
                          + "{\"page\":2,\"md\":\"\",\"text\":\"Body text\"}],"
                          + "\"job_metadata\":{\"job_pages\":2}}");
                }
                return new RawBody(200, "{\"status\":\"" + statuses.remove(0) + "\"}");
              });

      ExtractedContent content = client.parse(source, CertificateMode.STRICT);

      assertThat(content.nodes()).hasSize(2);
      assertThat(content.nodes().get(0).text()).isEqualTo("# Intro");
      assertThat(content.nodes().get(1).text()).isEqualTo("Body text");
      assertThat(content.nodes().get(1).metadata()).containsEntry("page_number", 2);
      assertThat(content.pageCount()).isEqualTo(2);

      assertThat(seen).hasSize(4);
      TransportRequest upload = seen.get(0);
      assertThat(upload.method()).isEqualTo(HttpMethod.POST);
      assertThat(upload.uri().toString()).isEqualTo(BASE + "/api/parsing/upload");
      assertThat(upload.headers().getFirst(HttpHeaders.AUTHORIZATION))
          .isEqualTo("Bearer llx-test");
      assertThat(seen.get(1).uri().getPath()).isEqualTo("/api/parsing/job/job-1");
      assertThat(seen.get(3).uri().getPath()).isEqualTo("/api/parsing/job/job-1/result/json");
    }

    @Test
    @DisplayName("Should fail when the job ends in ERROR")
    void shouldFailOnJobError() {
      when(transport.fetch(any(TransportRequest.class), any()))
          .thenAnswer(
              invocation -> {
                TransportRequest request = invocation.getArgument(0);
                return request.uri().getPath().equals(ParsingServiceClient.UPLOAD_PATH)
                    ? new RawBody(200, "{\"id\":\"job-2\"}")
                    : new RawBody(200, "{\"status\":\"ERROR\"}");
              });

      assertThatThrownBy(() -> client.parse(source, CertificateMode.STRICT))
          .isInstanceOf(ParsingJobException.class)
          .hasMessageContaining("ERROR")
          .satisfies(e -> assertThat(((ParsingJobException) e).isDeadlineExceeded()).isFalse());
    }

    @Test
    @DisplayName("Should give up once the ingestion deadline has passed")
    void shouldStopAtDeadline() {
      IngestionSource expired =
          new IngestionSource(
              "file-1", Path.of("report.pdf"), "report.pdf", "application/pdf", Instant.now());

      assertThatThrownBy(() -> client.parse(expired, CertificateMode.STRICT))
          .isInstanceOf(ParsingJobException.class)
          .satisfies(e -> assertThat(((ParsingJobException) e).isDeadlineExceeded()).isTrue());
      verify(transport, never()).fetch(any(), any());
    }

    @Test
    @DisplayName("Should fail when the upload returns no job id")
    void shouldFailWithoutJobId() {
      when(transport.fetch(any(TransportRequest.class), any())).thenReturn(new RawBody(200, "{}"));

      assertThatThrownBy(() -> client.parse(source, CertificateMode.STRICT))
          .isInstanceOf(ParsingJobException.class);
    }
  }

  @Nested
  @DisplayName("Result conversion")
  class ResultConversion {

    @Test
    @DisplayName("Should count pages from the array when a cache hit reports zero")
    void shouldUsePagesArrayOnCacheHit() throws Exception {
      ExtractedContent content =
          client.toContent(
              objectMapper.readTree(
                  "[{\"pages\":[{\"md\":\"a\"},{\"md\":\"b\"},{\"md\":\"c\"}],"
                      + "\"job_metadata\":{\"job_pages\":0,\"job_is_cache_hit\":true}}]"),
              "deck.pptx");

      assertThat(content.pageCount()).isEqualTo(3);
      assertThat(content.nodes().get(2).metadata())
          .containsEntry("page_number", 3)
          .containsEntry("source", "deck.pptx");
    }

    @Test
    @DisplayName("Should reject a result without any text")
    void shouldRejectEmptyResult() throws Exception {
      assertThatThrownBy(
              () ->
                  client.toContent(
                      objectMapper.readTree("{\"pages\":[{\"md\":\"  \",\"text\":\"\"}]}"),
                      "empty.pdf"))
          .isInstanceOf(ParsingJobException.class);
    }
  }

  @Test
  @DisplayName("Should only be configured with an API key")
  void shouldRequireApiKey() {
    RagGatewayConfig config = new RagGatewayConfig();
    assertThat(new ParsingServiceClient(transport, objectMapper, config).isConfigured()).isFalse();
    assertThat(client.isConfigured()).isTrue();
  }
}
