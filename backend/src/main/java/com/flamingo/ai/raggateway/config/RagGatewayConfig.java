package com.flamingo.ai.raggateway.config;

import com.flamingo.ai.raggateway.transport.CertificateMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for query routing, ingestion and outbound transport. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagGatewayConfig {

  /** Backend used when a request does not name one: "v1" (local) or "v2" (remote). */
  private String version = "v1";

  private Usage usage = new Usage();
  private Transport transport = new Transport();
  private Ingestion ingestion = new Ingestion();
  private Query query = new Query();
  private ParsingService parsingService = new ParsingService();
  private Remote remote = new Remote();
  private Local local = new Local();

  @Getter
  @Setter
  public static class Usage {
    /**
     * Allowed difference between a backend-reported total and input + output before a consistency
     * warning is logged. Some backends count overhead tokens in their total.
     */
    private int toleranceTokens = 0;
  }

  @Getter
  @Setter
  public static class Transport {
    private CertificateMode certificateMode = CertificateMode.STRICT;

    /** Optional PEM bundle used instead of the JVM trust store in STRICT mode. */
    private String caBundlePath;

    /** Optional PEM bundle overriding OS trust store detection in SYSTEM_TRUST_STORE mode. */
    private String systemTrustStorePath;

    private int connectTimeoutMs = 10_000;
    private int maxInMemorySize = 16 * 1024 * 1024;
  }

  @Getter
  @Setter
  public static class Ingestion {
    /** Deadline for the whole fallback chain; large files can take a while to parse remotely. */
    private long timeoutMs = 60_000;

    private long pollIntervalMs = 1_000;
  }

  @Getter
  @Setter
  public static class Query {
    private long timeoutMs = 5_000;
  }

  /** LlamaParse-compatible cloud parsing service. */
  @Getter
  @Setter
  public static class ParsingService {
    private String baseUrl = "https://api.cloud.llamaindex.ai";
    private String apiKey;
    private String resultType = "markdown";
    private String language = "en";
  }

  /** Remote NodeRAG retrieval service (v2). */
  @Getter
  @Setter
  public static class Remote {
    private String baseUrl = "http://localhost:5001";
    private String generatePath = "/api/v1/generate-response";
    private int maxTokens = 1024;
    private double temperature = 0.7;
  }

  /** In-process retrieval + generation pipeline (v1). */
  @Getter
  @Setter
  public static class Local {
    private int maxTokens = 1024;
    private double temperature = 0.7;
  }
}
