package dev.ragbench.pipeline;

import org.jspecify.annotations.Nullable;

/**
 * Static quality target for one pipeline.
 *
 * @param accuracyPct minimum accuracy in percent
 * @param p95LatencyMaxMs optional ceiling on the 95th percentile latency
 * @param errorRateMaxPct optional ceiling on the error rate in percent
 */
public record PipelineTarget(
    double accuracyPct, @Nullable Long p95LatencyMaxMs, @Nullable Double errorRateMaxPct) {

  public PipelineTarget {
    if (accuracyPct < 0.0 || accuracyPct > 100.0) {
      throw new IllegalArgumentException("accuracyPct must be in [0, 100] but was " + accuracyPct);
    }
  }

  public static PipelineTarget accuracy(double accuracyPct) {
    return new PipelineTarget(accuracyPct, null, null);
  }
}
