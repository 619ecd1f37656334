package com.flamingo.ai.raggateway.transport;

/** The server certificate or host name did not validate under the requested mode. */
public class CertificateVerificationFailedException extends TransportException {

  private final CertificateMode mode;

  public CertificateVerificationFailedException(
      CertificateMode mode, String validationMessage, Throwable cause) {
    super(validationMessage, cause);
    this.mode = mode;
  }

  public CertificateMode getMode() {
    return mode;
  }

  @Override
  public String getKind() {
    return "CERTIFICATE_VERIFICATION_FAILED";
  }
}
