package com.flamingo.ai.raggateway.ingestion;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * The file being ingested, as seen by every strategy of one chain run.
 *
 * @param fileId identifier reported back in the result
 * @param path local file location
 * @param fileName original file name, used as the {@code source} of content nodes
 * @param mimeType resolved MIME type
 * @param deadline point in time after which strategies must give up
 */
public record IngestionSource(
    String fileId, Path path, String fileName, String mimeType, Instant deadline) {

  /** Time left before the deadline, never negative. */
  public Duration remaining() {
    Duration left = Duration.between(Instant.now(), deadline);
    return left.isNegative() ? Duration.ZERO : left;
  }

  public boolean expired() {
    return !Instant.now().isBefore(deadline);
  }
}
