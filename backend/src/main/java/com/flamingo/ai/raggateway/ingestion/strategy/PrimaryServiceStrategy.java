package com.flamingo.ai.raggateway.ingestion.strategy;

import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import com.flamingo.ai.raggateway.ingestion.ExtractedContent;
import com.flamingo.ai.raggateway.ingestion.IngestionSource;
import com.flamingo.ai.raggateway.ingestion.IngestionStrategy;
import com.flamingo.ai.raggateway.ingestion.StrategyFailedException;
import com.flamingo.ai.raggateway.ingestion.llamaparse.ParsingJobException;
import com.flamingo.ai.raggateway.ingestion.llamaparse.ParsingServiceClient;
import com.flamingo.ai.raggateway.ingestion.model.FailureKind;
import com.flamingo.ai.raggateway.ingestion.model.ParseStrategy;
import com.flamingo.ai.raggateway.transport.CertificateMode;
import com.flamingo.ai.raggateway.transport.CertificateVerificationFailedException;
import com.flamingo.ai.raggateway.transport.NetworkTransportException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * First step of the chain: the cloud parsing service.
 *
 * <p>Runs under the configured certificate mode. A certificate failure under STRICT is retried once
 * under SYSTEM_TRUST_STORE, inside the same attempt; INSECURE is never chosen here.
 */
@Component
@Slf4j
public class PrimaryServiceStrategy implements IngestionStrategy {

  private final ParsingServiceClient client;
  private final CertificateMode configuredMode;
  private final MeterRegistry meterRegistry;

  public PrimaryServiceStrategy(
      ParsingServiceClient client, RagGatewayConfig ragGatewayConfig, MeterRegistry meterRegistry) {
    this.client = client;
    this.configuredMode = ragGatewayConfig.getTransport().getCertificateMode();
    this.meterRegistry = meterRegistry;
  }

  @Override
  public ParseStrategy kind() {
    return ParseStrategy.PRIMARY_SERVICE;
  }

  @Override
  public boolean supports(String mimeType) {
    return true;
  }

  @Override
  public ExtractedContent extract(IngestionSource source) throws StrategyFailedException {
    if (!client.isConfigured()) {
      throw new StrategyFailedException(
          FailureKind.NOT_CONFIGURED, "Parsing service API key is not configured");
    }

    CertificateMode mode = configuredMode != null ? configuredMode : CertificateMode.STRICT;
    try {
      return parse(source, mode);
    } catch (CertificateVerificationFailedException e) {
      if (mode != CertificateMode.STRICT) {
        throw certificateFailure(e.getMessage(), e);
      }
      log.warn(
          "Certificate verification failed for file {} under STRICT, retrying with system trust"
              + " store",
          source.fileId());
      meterRegistry.counter("ingestion.primary.trust_store_retry").increment();
      try {
        return parse(source, CertificateMode.SYSTEM_TRUST_STORE);
      } catch (CertificateVerificationFailedException retryFailure) {
        throw certificateFailure(
            "STRICT: " + e.getMessage() + "; SYSTEM_TRUST_STORE: " + retryFailure.getMessage(),
            retryFailure);
      }
    }
  }

  private ExtractedContent parse(IngestionSource source, CertificateMode mode)
      throws StrategyFailedException {
    try {
      return client.parse(source, mode);
    } catch (CertificateVerificationFailedException e) {
      throw e;
    } catch (NetworkTransportException e) {
      throw new StrategyFailedException(FailureKind.NETWORK, e.getMessage(), e);
    } catch (ParsingJobException e) {
      FailureKind kind = e.isDeadlineExceeded() ? FailureKind.TIMEOUT : FailureKind.PARSE_ERROR;
      throw new StrategyFailedException(kind, e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StrategyFailedException(
          FailureKind.INTERRUPTED, "Interrupted while waiting for the parsing job", e);
    }
  }

  private static StrategyFailedException certificateFailure(String message, Throwable cause) {
    return new StrategyFailedException(
        FailureKind.CERTIFICATE_VERIFICATION_FAILED, message, cause);
  }
}
