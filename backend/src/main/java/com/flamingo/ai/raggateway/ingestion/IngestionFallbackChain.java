package com.flamingo.ai.raggateway.ingestion;

import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import com.flamingo.ai.raggateway.exception.IngestionException;
import com.flamingo.ai.raggateway.ingestion.model.FailureKind;
import com.flamingo.ai.raggateway.ingestion.model.FailureReason;
import com.flamingo.ai.raggateway.ingestion.model.IngestionResult;
import com.flamingo.ai.raggateway.ingestion.model.ParseAttempt;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns an uploaded file into content by trying each {@link IngestionStrategy} in order until one
 * succeeds.
 *
 * <p>Strategies run one after another on the calling thread and share a single deadline. Those that
 * do not apply to the file's MIME type are skipped silently; every other one leaves exactly one
 * {@link ParseAttempt} in the audit trail. Content is only ever taken from the successful attempt.
 */
@Service
@Slf4j
public class IngestionFallbackChain {

  private final List<IngestionStrategy> strategies;
  private final MimeTypeResolver mimeTypeResolver;
  private final Duration timeout;
  private final MeterRegistry meterRegistry;

  public IngestionFallbackChain(
      List<IngestionStrategy> strategies,
      MimeTypeResolver mimeTypeResolver,
      RagGatewayConfig ragGatewayConfig,
      MeterRegistry meterRegistry) {
    this.strategies =
        strategies.stream().sorted(Comparator.comparing(IngestionStrategy::kind)).toList();
    this.mimeTypeResolver = mimeTypeResolver;
    this.timeout = Duration.ofMillis(ragGatewayConfig.getIngestion().getTimeoutMs());
    this.meterRegistry = meterRegistry;
  }

  /** Ingests a file under a generated file id. */
  @Timed(value = "ingestion.ingest", description = "Time to run the ingestion fallback chain")
  public IngestionResult ingest(Path file, String mimeHint) {
    return ingest(UUID.randomUUID().toString(), file, mimeHint);
  }

  /**
   * Ingests a file.
   *
   * @param fileId identifier reported in the result
   * @param file local file to read
   * @param mimeHint MIME type supplied by the caller, may be {@code null}
   * @return the successful strategy's content plus the full audit trail
   * @throws IngestionException if every applicable strategy failed, or the thread was interrupted
   */
  @Timed(value = "ingestion.ingest", description = "Time to run the ingestion fallback chain")
  public IngestionResult ingest(String fileId, Path file, String mimeHint) {
    return ingest(fileId, file, file.getFileName().toString(), mimeHint);
  }

  /** Variant for uploads whose original name differs from the stored file's name. */
  @Timed(value = "ingestion.ingest", description = "Time to run the ingestion fallback chain")
  public IngestionResult ingest(String fileId, Path file, String fileName, String mimeHint) {
    String mimeType = mimeTypeResolver.resolve(file, fileName, mimeHint);
    IngestionSource source =
        new IngestionSource(fileId, file, fileName, mimeType, Instant.now().plus(timeout));
    log.info("Ingesting file {} ({}, {})", fileId, fileName, mimeType);

    List<ParseAttempt> attempts = new ArrayList<>();
    for (IngestionStrategy strategy : strategies) {
      if (!strategy.supports(mimeType)) {
        log.debug("Skipping {} for {}", strategy.kind(), mimeType);
        continue;
      }
      if (Thread.currentThread().isInterrupted()) {
        if (!lastFailedWith(attempts, FailureKind.INTERRUPTED)) {
          attempts.add(
              ParseAttempt.failure(
                  strategy.kind(),
                  new FailureReason(FailureKind.INTERRUPTED, "Ingestion was interrupted"),
                  0));
        }
        break;
      }

      long start = System.nanoTime();
      try {
        ExtractedContent content = strategy.extract(source);
        long durationMs = elapsedMs(start);
        attempts.add(ParseAttempt.success(strategy.kind(), content.text(), durationMs));
        meterRegistry
            .counter("ingestion.strategy.success", "strategy", strategy.kind().name())
            .increment();
        log.info(
            "File {} ingested by {} after {} attempt(s) in {}ms",
            fileId,
            strategy.kind(),
            attempts.size(),
            durationMs);
        return new IngestionResult(
            fileId, strategy.kind(), content.nodes(), content.pageCount(), attempts);
      } catch (StrategyFailedException e) {
        attempts.add(ParseAttempt.failure(strategy.kind(), e.getReason(), elapsedMs(start)));
        meterRegistry
            .counter("ingestion.strategy.failure", "strategy", strategy.kind().name())
            .increment();
        log.warn("{} failed for file {}: {}", strategy.kind(), fileId, e.getReason());
      } catch (RuntimeException e) {
        FailureReason reason =
            new FailureReason(
                FailureKind.PARSE_ERROR, "Unexpected error (" + e.getClass().getSimpleName() + ")");
        attempts.add(ParseAttempt.failure(strategy.kind(), reason, elapsedMs(start)));
        meterRegistry
            .counter("ingestion.strategy.failure", "strategy", strategy.kind().name())
            .increment();
        log.warn("{} failed unexpectedly for file {}", strategy.kind(), fileId, e);
      }
    }

    meterRegistry.counter("ingestion.exhausted").increment();
    log.error(
        "All ingestion strategies failed for file {}: {}",
        fileId,
        IngestionException.describe(attempts));
    throw new IngestionException(
        IngestionException.Reason.ALL_STRATEGIES_EXHAUSTED, fileId, attempts);
  }

  private static boolean lastFailedWith(List<ParseAttempt> attempts, FailureKind kind) {
    if (attempts.isEmpty()) {
      return false;
    }
    FailureReason reason = attempts.get(attempts.size() - 1).failureReason();
    return reason != null && reason.kind() == kind;
  }

  private static long elapsedMs(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
  }
}
