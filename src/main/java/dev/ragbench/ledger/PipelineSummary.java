package dev.ragbench.ledger;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Per-pipeline results of one iteration.
 *
 * @param tested attempts made
 * @param correct attempts judged correct
 * @param errors attempts that carried an error
 * @param accuracyPct correct over tested in percent, one decimal
 * @param avgLatencyMs mean latency of attempts with a positive latency
 * @param p50LatencyMs median latency
 * @param p95LatencyMs 95th percentile latency
 * @param avgScore mean F1 over all attempts, four decimals
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PipelineSummary(
    int tested,
    int correct,
    int errors,
    @JsonAlias("accuracy_pct") double accuracyPct,
    @JsonAlias("avg_latency_ms") long avgLatencyMs,
    @JsonAlias("p50_latency_ms") long p50LatencyMs,
    @JsonAlias("p95_latency_ms") long p95LatencyMs,
    @JsonAlias("avg_f1") double avgScore) {

  /** Error rate in percent, 0 when nothing was tested. */
  public double errorRatePct() {
    return tested == 0 ? 0.0 : errors * 100.0 / tested;
  }
}
