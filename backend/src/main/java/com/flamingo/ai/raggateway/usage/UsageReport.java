package com.flamingo.ai.raggateway.usage;

/**
 * Normalized usage plus what was noticed while reading it.
 *
 * @param usage normalized counts
 * @param usageAvailable {@code false} when the backend response carried no usage map
 * @param totalMismatch {@code true} when the reported total disagreed with input + output beyond
 *     the configured tolerance
 */
public record UsageReport(TokenUsage usage, boolean usageAvailable, boolean totalMismatch) {}
