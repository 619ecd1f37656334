package com.flamingo.ai.raggateway.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import com.flamingo.ai.raggateway.transport.CertificateMode;
import com.flamingo.ai.raggateway.transport.RawBody;
import com.flamingo.ai.raggateway.transport.SecureHttpTransport;
import com.flamingo.ai.raggateway.transport.TransportRequest;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/** HTTP client for the remote (v2) graph retrieval service's {@code generate-response} call. */
@Component
@Slf4j
public class RemoteRetrievalClient {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final SecureHttpTransport transport;
  private final ObjectMapper objectMapper;
  private final RagGatewayConfig.Remote settings;
  private final CertificateMode certificateMode;
  private final Duration timeout;

  public RemoteRetrievalClient(
      SecureHttpTransport transport, ObjectMapper objectMapper, RagGatewayConfig ragGatewayConfig) {
    this.transport = transport;
    this.objectMapper = objectMapper;
    this.settings = ragGatewayConfig.getRemote();
    this.certificateMode = ragGatewayConfig.getTransport().getCertificateMode();
    this.timeout = Duration.ofMillis(ragGatewayConfig.getQuery().getTimeoutMs());
    log.info(
        "Remote retrieval client initialized: baseUrl={}, timeoutMs={}",
        settings.getBaseUrl(),
        timeout.toMillis());
  }

  /**
   * Asks the remote service to answer a query.
   *
   * @return the response body as a map
   * @throws com.flamingo.ai.raggateway.transport.TransportException on TLS or network failures
   * @throws MalformedBackendResponseException if the body is not a JSON object
   */
  public Map<String, Object> generate(
      String query, String organizationId, List<ConversationTurn> conversationHistory) {
    var request =
        new GenerateRequest(
            organizationId,
            query,
            conversationHistory == null ? List.of() : conversationHistory,
            settings.getMaxTokens(),
            settings.getTemperature());

    HttpHeaders headers = new HttpHeaders();
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    RawBody body =
        transport.fetch(
            TransportRequest.postJson(endpoint(), headers, request, timeout), certificateMode);
    log.debug("Remote response: {} chars", body.body().length());
    return parse(body.body());
  }

  private Map<String, Object> parse(String body) {
    JsonNode tree;
    try {
      tree = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new MalformedBackendResponseException("Response is not valid JSON", e);
    }
    if (tree == null || !tree.isObject()) {
      throw new MalformedBackendResponseException("Response is not a JSON object");
    }
    return objectMapper.convertValue(tree, MAP_TYPE);
  }

  private URI endpoint() {
    String base = settings.getBaseUrl();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + settings.getGeneratePath());
  }

  record GenerateRequest(
      @JsonProperty("org_id") String organizationId,
      String query,
      @JsonProperty("conversation_history") List<ConversationTurn> conversationHistory,
      @JsonProperty("max_tokens") int maxTokens,
      double temperature) {}
}
