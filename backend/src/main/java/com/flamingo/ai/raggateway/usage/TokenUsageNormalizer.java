package com.flamingo.ai.raggateway.usage;

import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import com.flamingo.ai.raggateway.query.BackendVersion;
import java.math.BigDecimal;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads token usage out of a raw backend response.
 *
 * <p>The local pipeline reports OpenAI-style {@code prompt_tokens}/{@code completion_tokens}; the
 * remote service may use either those or {@code input_tokens}/{@code output_tokens}. Counts may
 * arrive as numbers or numeric strings. This class never throws: anything unreadable counts as 0.
 */
@Component
@Slf4j
public class TokenUsageNormalizer {

  private static final BigDecimal MAX_COUNT = BigDecimal.valueOf(Long.MAX_VALUE);

  private final long toleranceTokens;

  public TokenUsageNormalizer(RagGatewayConfig ragGatewayConfig) {
    this.toleranceTokens = Math.max(0, ragGatewayConfig.getUsage().getToleranceTokens());
  }

  public TokenUsage normalize(Map<String, ?> raw, BackendVersion version) {
    return inspect(raw, version).usage();
  }

  public UsageReport inspect(Map<String, ?> raw, BackendVersion version) {
    Object usageValue = raw != null ? raw.get("usage") : null;
    if (!(usageValue instanceof Map<?, ?> usage)) {
      log.debug("No usage map in {} response", version);
      return new UsageReport(TokenUsage.ZERO, false, false);
    }

    long input;
    long output;
    if (version == BackendVersion.V2_REMOTE) {
      input = readFirst(usage, "prompt_tokens", "input_tokens");
      output = readFirst(usage, "completion_tokens", "output_tokens");
    } else {
      input = readCount(usage, "prompt_tokens");
      output = readCount(usage, "completion_tokens");
    }
    long reportedTotal = readCount(usage, "total_tokens");
    long sum = saturatedSum(input, output);

    if (reportedTotal == 0 && sum > 0) {
      return new UsageReport(new TokenUsage(input, output, sum), true, false);
    }

    boolean mismatch = Math.abs(reportedTotal - sum) > toleranceTokens;
    if (mismatch) {
      log.warn(
          "{} reported total_tokens={} but input + output = {} (tolerance {})",
          version,
          reportedTotal,
          sum,
          toleranceTokens);
    }
    return new UsageReport(new TokenUsage(input, output, reportedTotal), true, mismatch);
  }

  private static long saturatedSum(long input, long output) {
    try {
      return Math.addExact(input, output);
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private long readFirst(Map<?, ?> usage, String primaryKey, String fallbackKey) {
    return usage.get(primaryKey) != null
        ? readCount(usage, primaryKey)
        : readCount(usage, fallbackKey);
  }

  private long readCount(Map<?, ?> usage, String key) {
    Object value = usage.get(key);
    if (value == null) {
      return 0;
    }
    BigDecimal count;
    try {
      if (value instanceof Number || value instanceof String) {
        count = new BigDecimal(value.toString().strip());
      } else {
        log.warn("Ignoring non-numeric usage value for {}: {}", key, value.getClass().getName());
        return 0;
      }
    } catch (NumberFormatException e) {
      log.warn("Ignoring unparseable usage value for {}: '{}'", key, value);
      return 0;
    }
    if (count.signum() < 0) {
      log.warn("Ignoring negative usage value for {}: {}", key, count);
      return 0;
    }
    if (count.compareTo(MAX_COUNT) > 0) {
      log.warn("Clamping oversized usage value for {}: {}", key, count);
      return Long.MAX_VALUE;
    }
    return count.longValue();
  }
}
