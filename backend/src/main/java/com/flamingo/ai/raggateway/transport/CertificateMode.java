package com.flamingo.ai.raggateway.transport;

/**
 * How the server certificate is validated for a single outbound call.
 *
 * <p>The mode is always an explicit argument of {@link SecureHttpTransport#fetch}; nothing installs
 * a process-wide TLS default.
 */
public enum CertificateMode {

  /** JVM trust store (or the configured CA bundle) with hostname verification. */
  STRICT,

  /** Operating system trust store with hostname verification. */
  SYSTEM_TRUST_STORE,

  /** No certificate or hostname validation. Only used when a caller asks for it by name. */
  INSECURE
}
