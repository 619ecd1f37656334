package com.flamingo.ai.raggateway.query;

import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import com.flamingo.ai.raggateway.exception.RouterException;
import com.flamingo.ai.raggateway.transport.TransportException;
import com.flamingo.ai.raggateway.usage.TokenUsageNormalizer;
import com.flamingo.ai.raggateway.usage.UsageReport;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sends each query to exactly one backend and wraps the answer in a {@link ChatEnvelope}.
 *
 * <p>There is no failover: if the selected backend fails the caller gets a {@link RouterException}
 * and the other backend is never called.
 */
@Service
@Slf4j
public class QueryRouter {

  static final Set<String> RESERVED_KEYS = Set.of("answer", "response", "sources", "usage");
  static final List<String> SOURCE_ID_KEYS = List.of("file_id", "id", "source");

  private final LocalRagPipeline localPipeline;
  private final RemoteRetrievalClient remoteClient;
  private final TokenUsageNormalizer usageNormalizer;
  private final String defaultVersion;
  private final MeterRegistry meterRegistry;

  public QueryRouter(
      LocalRagPipeline localPipeline,
      RemoteRetrievalClient remoteClient,
      TokenUsageNormalizer usageNormalizer,
      RagGatewayConfig ragGatewayConfig,
      MeterRegistry meterRegistry) {
    this.localPipeline = localPipeline;
    this.remoteClient = remoteClient;
    this.usageNormalizer = usageNormalizer;
    this.defaultVersion = ragGatewayConfig.getVersion();
    this.meterRegistry = meterRegistry;
  }

  /**
   * Routes a query, resolving the backend from its version string.
   *
   * @param ragVersion {@code "v1"}, {@code "v2"} or {@code null} for the configured default
   */
  @Timed(value = "rag.query.route", description = "Time to answer a query")
  public ChatEnvelope route(
      String query,
      String organizationId,
      String ragVersion,
      List<ConversationTurn> conversationHistory) {
    String requested = ragVersion == null || ragVersion.isBlank() ? defaultVersion : ragVersion;
    return route(query, organizationId, BackendVersion.fromValue(requested), conversationHistory);
  }

  /**
   * Routes a query to the given backend.
   *
   * @throws IllegalArgumentException if the query or organization id is blank
   * @throws RouterException with reason {@code INVALID_VERSION} if no version is given, or {@code
   *     BACKEND_UNAVAILABLE} if the backend fails
   */
  @Timed(value = "rag.query.route", description = "Time to answer a query")
  public ChatEnvelope route(
      String query,
      String organizationId,
      BackendVersion version,
      List<ConversationTurn> conversationHistory) {
    if (version == null) {
      throw RouterException.invalidVersion(null);
    }
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query is required");
    }
    if (organizationId == null || organizationId.isBlank()) {
      throw new IllegalArgumentException("Organization id is required");
    }
    List<ConversationTurn> history =
        conversationHistory == null ? List.of() : conversationHistory;
    log.info(
        "Routing query for org {} to {} ({} history turns)",
        organizationId,
        version,
        history.size());

    Map<String, Object> raw;
    try {
      raw =
          switch (version) {
            case V1_LOCAL -> localPipeline.answer(query, organizationId, history);
            case V2_REMOTE -> remoteClient.generate(query, organizationId, history);
          };
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.query.failure", "version", version.getValue()).increment();
      String cause = describeFailure(e);
      log.error("Backend {} failed for org {}: {}", version, organizationId, cause, e);
      throw RouterException.backendUnavailable(version, cause, e);
    }
    if (raw == null) {
      meterRegistry.counter("rag.query.failure", "version", version.getValue()).increment();
      throw RouterException.backendUnavailable(version, "empty response", null);
    }

    ChatEnvelope envelope = toEnvelope(query, organizationId, version, raw);
    meterRegistry.counter("rag.query.success", "version", version.getValue()).increment();
    return envelope;
  }

  private ChatEnvelope toEnvelope(
      String query, String organizationId, BackendVersion version, Map<String, Object> raw) {
    UsageReport usage = usageNormalizer.inspect(raw, version);

    Map<String, Object> metadata = new LinkedHashMap<>();
    raw.forEach(
        (key, value) -> {
          if (!RESERVED_KEYS.contains(key)) {
            metadata.put(key, value);
          }
        });
    if (!usage.usageAvailable()) {
      metadata.put("usage_unavailable", true);
      meterRegistry.counter("rag.usage.unavailable", "version", version.getValue()).increment();
    }
    if (usage.totalMismatch()) {
      metadata.put("usage_total_mismatch", true);
      meterRegistry.counter("rag.usage.total_mismatch", "version", version.getValue()).increment();
    }

    return ChatEnvelope.builder()
        .query(query)
        .organizationId(organizationId)
        .answerText(answerText(raw, version))
        .sources(collectSources(raw.get("sources")))
        .tokenUsage(usage.usage())
        .backendVersion(version)
        .metadata(metadata)
        .build();
  }

  private String answerText(Map<String, Object> raw, BackendVersion version) {
    Object answer = raw.get("answer") != null ? raw.get("answer") : raw.get("response");
    if (answer == null) {
      log.warn("{} response carried no answer text", version);
      return "";
    }
    return answer.toString();
  }

  static Set<String> collectSources(Object value) {
    Set<String> sources = new LinkedHashSet<>();
    if (value instanceof String single) {
      addIfPresent(sources, single);
    } else if (value instanceof Collection<?> entries) {
      for (Object entry : entries) {
        if (entry instanceof String id) {
          addIfPresent(sources, id);
        } else if (entry instanceof Map<?, ?> map) {
          SOURCE_ID_KEYS.stream()
              .map(map::get)
              .filter(Objects::nonNull)
              .findFirst()
              .ifPresent(id -> addIfPresent(sources, id.toString()));
        }
      }
    }
    return sources;
  }

  private static void addIfPresent(Set<String> sources, String id) {
    if (!id.isBlank()) {
      sources.add(id);
    }
  }

  private static String describeFailure(RuntimeException e) {
    if (e instanceof TransportException || e instanceof MalformedBackendResponseException) {
      return e.getMessage();
    }
    return "backend error (" + e.getClass().getSimpleName() + ")";
  }
}
