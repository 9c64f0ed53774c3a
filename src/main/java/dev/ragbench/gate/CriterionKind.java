package dev.ragbench.gate;

/** What a gate criterion measures. */
public enum CriterionKind {
  PIPELINE_ACCURACY,
  P95_LATENCY,
  ERROR_RATE,
  OVERALL_ACCURACY,
  OVERALL_ERROR_RATE,
  STABILITY,
  PREREQUISITE
}
