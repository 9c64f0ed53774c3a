package dev.ragbench.ledger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Computes per-pipeline {@link PipelineSummary} values from a list of attempts. */
public final class IterationSummaries {

  private IterationSummaries() {}

  /**
   * Summarises attempts per pipeline, in first-seen pipeline order.
   *
   * @param attempts attempts of one iteration
   * @return summary per pipeline; empty when there are no attempts
   */
  public static Map<String, PipelineSummary> summarize(List<Attempt> attempts) {
    Map<String, List<Attempt>> byPipeline = new LinkedHashMap<>();
    for (Attempt attempt : attempts) {
      String pipeline = attempt.pipeline() == null ? "unknown" : attempt.pipeline();
      byPipeline.computeIfAbsent(pipeline, k -> new ArrayList<>()).add(attempt);
    }
    Map<String, PipelineSummary> summaries = new LinkedHashMap<>();
    byPipeline.forEach((pipeline, group) -> summaries.put(pipeline, summarizeOne(group)));
    return summaries;
  }

  static PipelineSummary summarizeOne(List<Attempt> attempts) {
    int tested = attempts.size();
    int correct = 0;
    int errors = 0;
    double scoreSum = 0.0;
    List<Long> latencies = new ArrayList<>(tested);
    for (Attempt attempt : attempts) {
      if (attempt.correct()) {
        correct++;
      }
      if (attempt.hasError()) {
        errors++;
      }
      if (attempt.latencyMs() > 0) {
        latencies.add(attempt.latencyMs());
      }
      scoreSum += attempt.score();
    }
    latencies.sort(null);
    double accuracy = tested == 0 ? 0.0 : round(correct * 100.0 / tested, 1);
    double avgScore = tested == 0 ? 0.0 : round(scoreSum / tested, 4);
    long avgLatency =
        latencies.isEmpty()
            ? 0
            : (long) latencies.stream().mapToLong(Long::longValue).average().orElse(0.0);
    return new PipelineSummary(
        tested,
        correct,
        errors,
        accuracy,
        avgLatency,
        percentile(latencies, 0.50),
        percentile(latencies, 0.95),
        avgScore);
  }

  /** Nearest-rank on the sorted list: {@code sorted[floor(n * q)]}, clamped to the last index. */
  static long percentile(List<Long> sorted, double quantile) {
    if (sorted.isEmpty()) {
      return 0;
    }
    int index = Math.min(sorted.size() - 1, (int) (sorted.size() * quantile));
    return sorted.get(index);
  }

  static double round(double value, int decimals) {
    double factor = Math.pow(10, decimals);
    return Math.round(value * factor) / factor;
  }
}
