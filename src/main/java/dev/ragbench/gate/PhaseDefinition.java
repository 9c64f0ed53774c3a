package dev.ragbench.gate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Criteria declared by one phase.
 *
 * @param name display name
 * @param requiresPhase phase that must pass first, or null
 * @param pipelineTargets minimum accuracy per pipeline in percent
 * @param overallTarget minimum pooled accuracy in percent, or null
 * @param p95LatencyMaxMs p95 latency ceiling per pipeline
 * @param errorRateMaxPct error-rate ceiling per pipeline in percent
 * @param overallErrorRateMaxPct pooled error-rate ceiling in percent, or null
 * @param stableIterations consecutive stable iterations required, 0 to skip the check
 */
public record PhaseDefinition(
    String name,
    @Nullable Integer requiresPhase,
    Map<String, Double> pipelineTargets,
    @Nullable Double overallTarget,
    Map<String, Long> p95LatencyMaxMs,
    Map<String, Double> errorRateMaxPct,
    @Nullable Double overallErrorRateMaxPct,
    @DefaultValue("0") int stableIterations) {

  public PhaseDefinition {
    if (name == null || name.isBlank()) {
      throw new IllegalStateException("ragbench.gate.phases.*.name must not be blank");
    }
    pipelineTargets = copy(pipelineTargets);
    p95LatencyMaxMs = copy(p95LatencyMaxMs);
    errorRateMaxPct = copy(errorRateMaxPct);
    if (stableIterations < 0) {
      throw new IllegalStateException(
          "ragbench.gate.phases.*.stable-iterations must be >= 0, got: " + stableIterations);
    }
  }

  private static <V> Map<String, V> copy(@Nullable Map<String, V> source) {
    return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
