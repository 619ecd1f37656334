package com.flamingo.ai.raggateway.transport;

import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.List;
import java.util.Locale;
import javax.net.ssl.TrustManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resolves the trust material behind {@link CertificateMode#STRICT} and {@link
 * CertificateMode#SYSTEM_TRUST_STORE}.
 *
 * <p>STRICT trusts the JVM store unless a CA bundle is configured. SYSTEM_TRUST_STORE trusts the
 * operating system's own store: {@code Windows-ROOT} on Windows, {@code KeychainStore} on macOS and
 * the distribution PEM bundle elsewhere.
 */
@Component
@Slf4j
public class TrustStoreProvider {

  static final List<String> LINUX_CA_BUNDLES =
      List.of(
          "/etc/ssl/certs/ca-certificates.crt",
          "/etc/pki/tls/certs/ca-bundle.crt",
          "/etc/ssl/ca-bundle.pem",
          "/etc/pki/ca-trust/extracted/pem/tls-ca-bundle.pem",
          "/etc/ssl/cert.pem");

  private final String caBundlePath;
  private final String systemTrustStorePath;

  public TrustStoreProvider(RagGatewayConfig ragGatewayConfig) {
    this.caBundlePath = ragGatewayConfig.getTransport().getCaBundlePath();
    this.systemTrustStorePath = ragGatewayConfig.getTransport().getSystemTrustStorePath();
  }

  /** Trust managers for STRICT mode. */
  public TrustManagerFactory strictTrust() {
    if (caBundlePath != null && !caBundlePath.isBlank()) {
      log.info("STRICT trust uses configured CA bundle");
      return fromKeyStore(loadPemBundle(Path.of(caBundlePath)));
    }
    return fromKeyStore(null);
  }

  /** Trust managers for SYSTEM_TRUST_STORE mode. */
  public TrustManagerFactory systemTrust() {
    if (systemTrustStorePath != null && !systemTrustStorePath.isBlank()) {
      return fromKeyStore(loadPemBundle(Path.of(systemTrustStorePath)));
    }

    String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
    if (os.contains("win")) {
      return fromKeyStore(loadPlatformStore("Windows-ROOT"));
    }
    if (os.contains("mac")) {
      return fromKeyStore(loadPlatformStore("KeychainStore"));
    }
    for (String candidate : LINUX_CA_BUNDLES) {
      Path bundle = Path.of(candidate);
      if (Files.isReadable(bundle)) {
        log.debug("System trust store resolved to {}", bundle);
        return fromKeyStore(loadPemBundle(bundle));
      }
    }

    log.warn("No operating system trust store found, SYSTEM_TRUST_STORE falls back to JVM store");
    return fromKeyStore(null);
  }

  static KeyStore loadPemBundle(Path bundle) {
    try (InputStream in = Files.newInputStream(bundle)) {
      KeyStore keyStore = KeyStore.getInstance(KeyStore.getDefaultType());
      keyStore.load(null, null);
      int index = 0;
      for (Certificate certificate :
          CertificateFactory.getInstance("X.509").generateCertificates(in)) {
        keyStore.setCertificateEntry("ca-" + index++, certificate);
      }
      if (index == 0) {
        throw new IllegalStateException("CA bundle contains no certificates: " + bundle);
      }
      return keyStore;
    } catch (IOException | GeneralSecurityException e) {
      throw new IllegalStateException("Failed to load CA bundle " + bundle, e);
    }
  }

  private KeyStore loadPlatformStore(String type) {
    try {
      KeyStore keyStore = KeyStore.getInstance(type);
      keyStore.load(null, null);
      return keyStore;
    } catch (IOException | GeneralSecurityException e) {
      throw new IllegalStateException("Failed to open platform trust store " + type, e);
    }
  }

  private TrustManagerFactory fromKeyStore(KeyStore keyStore) {
    try {
      TrustManagerFactory factory =
          TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
      factory.init(keyStore);
      return factory;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to initialise trust managers", e);
    }
  }
}
