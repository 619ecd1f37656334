package com.flamingo.ai.raggateway.transport;

import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.security.cert.CertPathBuilderException;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.TrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.Http11SslContextSpec;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * Outbound HTTP(S) with an explicit certificate mode per call.
 *
 * <p>One {@link WebClient} is built per {@link CertificateMode}; all of them share a single Reactor
 * Netty connection pool, so the transport is safe for concurrent use. Failures are classified into
 * {@link CertificateVerificationFailedException} and {@link NetworkTransportException}. The
 * transport never changes mode on its own: retrying under a looser mode is the caller's decision.
 */
@Component
@Slf4j
public class SecureHttpTransport {

  private final Map<CertificateMode, WebClient> clients;

  public SecureHttpTransport(RagGatewayConfig ragGatewayConfig, TrustStoreProvider trustStores) {
    RagGatewayConfig.Transport transport = ragGatewayConfig.getTransport();
    ConnectionProvider pool =
        ConnectionProvider.builder("rag-gateway-transport").maxConnections(100).build();

    Map<CertificateMode, WebClient> built = new EnumMap<>(CertificateMode.class);
    built.put(
        CertificateMode.STRICT, buildClient(pool, trustStores.strictTrust(), true, transport));
    built.put(
        CertificateMode.SYSTEM_TRUST_STORE,
        buildClient(pool, trustStores.systemTrust(), true, transport));
    built.put(
        CertificateMode.INSECURE,
        buildClient(pool, InsecureTrustManagerFactory.INSTANCE, false, transport));
    this.clients = Collections.unmodifiableMap(built);

    log.info(
        "Secure transport initialized: defaultMode={}, connectTimeoutMs={}",
        transport.getCertificateMode(),
        transport.getConnectTimeoutMs());
  }

  /**
   * Performs one call and returns its 2xx body.
   *
   * @param request the call to make, including its timeout
   * @param mode certificate validation mode for this call only
   * @return status and body of a successful response
   * @throws CertificateVerificationFailedException if the certificate or host name did not validate
   * @throws NetworkTransportException on timeouts, connection errors or non-2xx statuses
   */
  public RawBody fetch(TransportRequest request, CertificateMode mode) {
    CertificateMode effectiveMode = mode != null ? mode : CertificateMode.STRICT;
    if (effectiveMode == CertificateMode.INSECURE) {
      log.warn("Certificate validation disabled for call to host {}", request.uri().getHost());
    }

    WebClient.RequestBodySpec spec =
        clients
            .get(effectiveMode)
            .method(request.method())
            .uri(request.uri())
            .headers(
                headers -> {
                  if (request.headers() != null) {
                    headers.addAll(request.headers());
                  }
                });
    WebClient.RequestHeadersSpec<?> ready =
        request.body() == null
            ? spec
            : spec.contentType(request.contentType()).bodyValue(request.body());

    RawBody raw;
    try {
      raw =
          ready
              .exchangeToMono(
                  response ->
                      response
                          .bodyToMono(String.class)
                          .defaultIfEmpty("")
                          .map(body -> new RawBody(response.statusCode().value(), body)))
              .timeout(request.timeout())
              .block();
    } catch (RuntimeException e) {
      TransportException classified = classify(e, effectiveMode);
      log.debug(
          "{} {} failed under {}: {}",
          request.method(),
          request.uri().getHost(),
          effectiveMode,
          classified.getMessage());
      throw classified;
    }

    if (raw == null) {
      throw new NetworkTransportException(null, "Empty response");
    }
    if (raw.statusCode() < 200 || raw.statusCode() >= 300) {
      log.debug(
          "{} {} returned HTTP {} ({} body chars)",
          request.method(),
          request.uri().getHost(),
          raw.statusCode(),
          raw.body().length());
      throw new NetworkTransportException(raw.statusCode(), "HTTP " + raw.statusCode());
    }
    return raw;
  }

  /** Maps a failed exchange onto the transport error taxonomy by walking the cause chain. */
  static TransportException classify(Throwable error, CertificateMode mode) {
    for (Throwable t = error; t != null; t = next(t)) {
      if (t instanceof TransportException transportException) {
        return transportException;
      }
      if (t instanceof CertificateException
          || t instanceof CertPathValidatorException
          || t instanceof CertPathBuilderException
          || t instanceof SSLPeerUnverifiedException
          || (t instanceof SSLHandshakeException && mentionsCertificate(t.getMessage()))) {
        return new CertificateVerificationFailedException(
            mode, "Certificate verification failed: " + t.getMessage(), error);
      }
    }

    for (Throwable t = error; t != null; t = next(t)) {
      if (t instanceof TimeoutException) {
        return new NetworkTransportException(null, "Request timed out", error);
      }
      if (t instanceof UnknownHostException) {
        return new NetworkTransportException(null, "Host could not be resolved", error);
      }
      if (t instanceof ConnectException) {
        return new NetworkTransportException(null, "Connection refused", error);
      }
      if (t instanceof InterruptedException) {
        Thread.currentThread().interrupt();
        return new NetworkTransportException(null, "Request interrupted", error);
      }
    }

    return new NetworkTransportException(
        null, "Request failed: " + rootCause(error).getClass().getSimpleName(), error);
  }

  private static WebClient buildClient(
      ConnectionProvider pool,
      TrustManagerFactory trust,
      boolean verifyHostname,
      RagGatewayConfig.Transport transport) {
    Http11SslContextSpec sslSpec =
        Http11SslContextSpec.forClient().configure(builder -> builder.trustManager(trust));

    HttpClient httpClient =
        HttpClient.create(pool)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, transport.getConnectTimeoutMs())
            .secure(
                ssl -> {
                  if (verifyHostname) {
                    ssl.sslContext(sslSpec);
                  } else {
                    ssl.sslContext(sslSpec)
                        .handlerConfigurator(SecureHttpTransport::disableHostnameVerification);
                  }
                });

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .codecs(c -> c.defaultCodecs().maxInMemorySize(transport.getMaxInMemorySize()))
        .build();
  }

  private static void disableHostnameVerification(SslHandler handler) {
    SSLEngine engine = handler.engine();
    SSLParameters parameters = engine.getSSLParameters();
    parameters.setEndpointIdentificationAlgorithm(null);
    engine.setSSLParameters(parameters);
  }

  private static boolean mentionsCertificate(String message) {
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    return lower.contains("certificate")
        || lower.contains("pkix")
        || lower.contains("subject alternative")
        || lower.contains("hostname");
  }

  private static Throwable next(Throwable t) {
    return t.getCause() == t ? null : t.getCause();
  }

  private static Throwable rootCause(Throwable error) {
    Throwable root = error;
    while (next(root) != null) {
      root = next(root);
    }
    return root;
  }
}
