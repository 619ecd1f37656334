package com.flamingo.ai.raggateway.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import com.flamingo.ai.raggateway.transport.CertificateMode;
import com.flamingo.ai.raggateway.transport.RawBody;
import com.flamingo.ai.raggateway.transport.SecureHttpTransport;
import com.flamingo.ai.raggateway.transport.TransportRequest;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;

@ExtendWith(MockitoExtension.class)
@DisplayName("RemoteRetrievalClient Tests")
class RemoteRetrievalClientTest {

  @Mock private SecureHttpTransport transport;

  private RemoteRetrievalClient client;

  @BeforeEach
  void setUp() {
    RagGatewayConfig config = new RagGatewayConfig();
    config.getRemote().setBaseUrl("https://noderag.internal/");
    config.getQuery().setTimeoutMs(2500);
    config.getTransport().setCertificateMode(CertificateMode.SYSTEM_TRUST_STORE);
    client = new RemoteRetrievalClient(transport, new ObjectMapper(), config);
  }

  @Test
  @DisplayName("Should post the query with the configured mode and timeout")
  void shouldPostQuery() {
    when(transport.fetch(any(TransportRequest.class), eq(CertificateMode.SYSTEM_TRUST_STORE)))
        .thenReturn(new RawBody(200, "{\"response\":\"hi\",\"sources\":[\"file_abc123\"]}"));

    Map<String, Object> result =
        client.generate("Hello?", "org-7", List.of(new ConversationTurn("user", "earlier")));

    assertThat(result).containsEntry("response", "hi");
    assertThat(result.get("sources")).isEqualTo(List.of("file_abc123"));

    ArgumentCaptor<TransportRequest> captor = ArgumentCaptor.forClass(TransportRequest.class);
    verify(transport).fetch(captor.capture(), eq(CertificateMode.SYSTEM_TRUST_STORE));
    TransportRequest request = captor.getValue();
    assertThat(request.method()).isEqualTo(HttpMethod.POST);
    assertThat(request.uri().toString())
        .isEqualTo("https://noderag.internal/api/v1/generate-response");
    assertThat(request.timeout()).isEqualTo(Duration.ofMillis(2500));

    Map<String, Object> payload =
        new ObjectMapper()
            .convertValue(request.body(), new TypeReference<Map<String, Object>>() {});
    assertThat(payload)
        .containsEntry("org_id", "org-7")
        .containsEntry("query", "Hello?")
        .containsEntry("max_tokens", 1024)
        .containsKey("conversation_history");
  }

  @Test
  @DisplayName("Should reject a body that is not a JSON object")
  void shouldRejectNonObjectBody() {
    when(transport.fetch(any(TransportRequest.class), any())).thenReturn(new RawBody(200, "[1]"));

    assertThatThrownBy(() -> client.generate("q", "org-1", null))
        .isInstanceOf(MalformedBackendResponseException.class);
  }

  @Test
  @DisplayName("Should reject a body that is not JSON at all")
  void shouldRejectInvalidJson() {
    when(transport.fetch(any(TransportRequest.class), any()))
        .thenReturn(new RawBody(200, "<html>oops</html>"));

    assertThatThrownBy(() -> client.generate("q", "org-1", null))
        .isInstanceOf(MalformedBackendResponseException.class)
        .hasMessageNotContaining("noderag.internal");
  }
}
