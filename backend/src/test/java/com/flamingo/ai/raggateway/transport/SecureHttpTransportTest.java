package com.flamingo.ai.raggateway.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertificateException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

@DisplayName("SecureHttpTransport Tests")
class SecureHttpTransportTest {

  @Nested
  @DisplayName("Against a local HTTP server")
  class LocalServer {

    private HttpServer server;
    private SecureHttpTransport transport;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
      server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
      server.createContext("/ok", exchange -> respond(exchange, 200, "{\"ok\":true}"));
      server.createContext("/echo", exchange -> {
        byte[] body = exchange.getRequestBody().readAllBytes();
        respond(exchange, 200, new String(body, StandardCharsets.UTF_8));
      });
      server.createContext("/fail", exchange -> respond(exchange, 502, "upstream down"));
      server.createContext(
          "/slow",
          exchange -> {
            try {
              Thread.sleep(2_000);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            respond(exchange, 200, "late");
          });
      server.start();
      baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

      RagGatewayConfig config = new RagGatewayConfig();
      transport = new SecureHttpTransport(config, new TrustStoreProvider(config));
    }

    @AfterEach
    void tearDown() {
      server.stop(0);
    }

    private void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body)
        throws IOException {
      byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(status, bytes.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(bytes);
      }
    }

    @Test
    @DisplayName("Should return status and body of a 2xx response")
    void shouldReturnBody() {
      RawBody body =
          transport.fetch(
              TransportRequest.get(
                  URI.create(baseUrl + "/ok"), new HttpHeaders(), Duration.ofSeconds(5)),
              CertificateMode.STRICT);

      assertThat(body.statusCode()).isEqualTo(200);
      assertThat(body.body()).isEqualTo("{\"ok\":true}");
    }

    @Test
    @DisplayName("Should send JSON bodies")
    void shouldSendJson() {
      RawBody body =
          transport.fetch(
              TransportRequest.postJson(
                  URI.create(baseUrl + "/echo"),
                  new HttpHeaders(),
                  Map.of("query", "hi"),
                  Duration.ofSeconds(5)),
              CertificateMode.SYSTEM_TRUST_STORE);

      assertThat(body.body()).isEqualTo("{\"query\":\"hi\"}");
    }

    @Test
    @DisplayName("Should raise NetworkTransportException with the status for non-2xx responses")
    void shouldRejectErrorStatus() {
      assertThatThrownBy(
              () ->
                  transport.fetch(
                      TransportRequest.get(
                          URI.create(baseUrl + "/fail"), null, Duration.ofSeconds(5)),
                      CertificateMode.STRICT))
          .isInstanceOf(NetworkTransportException.class)
          .satisfies(
              e -> assertThat(((NetworkTransportException) e).getStatusCode()).isEqualTo(502))
          .hasMessage("HTTP 502");
    }

    @Test
    @DisplayName("Should time out according to the per-request timeout")
    void shouldTimeOut() {
      assertThatThrownBy(
              () ->
                  transport.fetch(
                      TransportRequest.get(
                          URI.create(baseUrl + "/slow"), null, Duration.ofMillis(200)),
                      CertificateMode.STRICT))
          .isInstanceOf(NetworkTransportException.class)
          .hasMessage("Request timed out");
    }

    @Test
    @DisplayName("Should classify a refused connection without leaking the URL")
    void shouldClassifyRefusedConnection() throws IOException {
      int freePort;
      try (ServerSocket socket = new ServerSocket(0)) {
        freePort = socket.getLocalPort();
      }

      assertThatThrownBy(
              () ->
                  transport.fetch(
                      TransportRequest.get(
                          URI.create("http://127.0.0.1:" + freePort + "/x?token=secret"),
                          null,
                          Duration.ofSeconds(5)),
                      CertificateMode.STRICT))
          .isInstanceOf(NetworkTransportException.class)
          .hasMessage("Connection refused");
    }
  }

  @Nested
  @DisplayName("Error classification")
  class Classification {

    @Test
    @DisplayName("Should classify a PKIX failure as a certificate failure")
    void shouldClassifyPkixFailure() {
      Throwable error =
          new RuntimeException(
              new SSLHandshakeException(
                  "PKIX path building failed: unable to find valid certification path"));

      TransportException classified =
          SecureHttpTransport.classify(error, CertificateMode.STRICT);

      assertThat(classified).isInstanceOf(CertificateVerificationFailedException.class);
      assertThat(((CertificateVerificationFailedException) classified).getMode())
          .isEqualTo(CertificateMode.STRICT);
      assertThat(classified.getKind()).isEqualTo("CERTIFICATE_VERIFICATION_FAILED");
      assertThat(classified.getMessage()).contains("PKIX path building failed");
    }

    @Test
    @DisplayName("Should classify nested certificate exceptions")
    void shouldClassifyNestedCertificateExceptions() {
      Throwable error =
          new IllegalStateException(
              new CertificateException(
                  "No subject alternative DNS name matching host found",
                  new CertPathValidatorException("expired")));

      assertThat(SecureHttpTransport.classify(error, CertificateMode.SYSTEM_TRUST_STORE))
          .isInstanceOf(CertificateVerificationFailedException.class);
    }

    @Test
    @DisplayName("Should not treat a protocol handshake failure as a certificate failure")
    void shouldTreatProtocolFailureAsNetwork() {
      Throwable error = new SSLHandshakeException("Received fatal alert: protocol_version");

      assertThat(SecureHttpTransport.classify(error, CertificateMode.STRICT))
          .isInstanceOf(NetworkTransportException.class);
    }

    @Test
    @DisplayName("Should classify DNS, refused connections and timeouts as network failures")
    void shouldClassifyNetworkFailures() {
      assertThat(
              SecureHttpTransport.classify(
                  new RuntimeException(new UnknownHostException("nohost")),
                  CertificateMode.STRICT))
          .hasMessage("Host could not be resolved");
      assertThat(
              SecureHttpTransport.classify(
                  new RuntimeException(new ConnectException("refused")), CertificateMode.STRICT))
          .hasMessage("Connection refused");
      assertThat(
              SecureHttpTransport.classify(new TimeoutException(), CertificateMode.STRICT))
          .hasMessage("Request timed out");
    }

    @Test
    @DisplayName("Should pass already classified exceptions through")
    void shouldPassThroughClassified() {
      NetworkTransportException original = new NetworkTransportException(404, "HTTP 404");

      assertThat(SecureHttpTransport.classify(original, CertificateMode.STRICT))
          .isSameAs(original);
    }
  }
}
