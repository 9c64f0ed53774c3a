package dev.ragbench.pipeline;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Pipelines under test and how to call them, bound from {@code ragbench.pipeline.*}.
 *
 * <p>Each entry of {@code endpoints} names one pipeline; its URL, read timeout and quality target
 * are configured together.
 */
@ConfigurationProperties(prefix = "ragbench.pipeline")
public record PipelineProperties(
    @DefaultValue("benchmark") String tenantId,
    @DefaultValue("10000") int connectTimeoutMs,
    @DefaultValue("2000") int maxAnswerLength,
    @DefaultValue Retry retry,
    Map<String, Endpoint> endpoints) {

  public PipelineProperties {
    endpoints = endpoints == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(endpoints));
    if (maxAnswerLength < 1) {
      throw new IllegalStateException(
          "ragbench.pipeline.max-answer-length must be positive, got: " + maxAnswerLength);
    }
  }

  /** Returns the endpoint of a pipeline, or null if the pipeline is not configured. */
  public @Nullable Endpoint endpoint(String pipeline) {
    return endpoints.get(pipeline);
  }

  /** Returns the quality target of every configured pipeline. */
  public Map<String, PipelineTarget> targets() {
    Map<String, PipelineTarget> targets = new LinkedHashMap<>();
    endpoints.forEach((name, endpoint) -> targets.put(name, endpoint.target()));
    return targets;
  }

  /**
   * Retry schedule shared by every pipeline call.
   *
   * @param maxAttempts total attempts including the first one
   * @param initialDelayMs first backoff delay
   * @param multiplier exponential backoff multiplier
   * @param maxDelayMs cap on a single backoff delay
   */
  public record Retry(
      @DefaultValue("5") int maxAttempts,
      @DefaultValue("2000") long initialDelayMs,
      @DefaultValue("2.0") double multiplier,
      @DefaultValue("30000") long maxDelayMs) {

    public Retry {
      if (maxAttempts < 1) {
        throw new IllegalStateException(
            "ragbench.pipeline.retry.max-attempts must be >= 1, got: " + maxAttempts);
      }
      if (maxDelayMs > 30_000) {
        throw new IllegalStateException(
            "ragbench.pipeline.retry.max-delay-ms must be <= 30000, got: " + maxDelayMs);
      }
    }
  }

  /**
   * One pipeline endpoint.
   *
   * @param url webhook URL accepting {@code {query, tenant_id, session_id}}
   * @param timeoutMs read timeout for a single call
   * @param targetAccuracy accuracy target in percent
   * @param p95LatencyMaxMs optional p95 latency ceiling
   * @param errorRateMaxPct optional error-rate ceiling in percent
   */
  public record Endpoint(
      String url,
      @DefaultValue("60000") int timeoutMs,
      @DefaultValue("70.0") double targetAccuracy,
      @Nullable Long p95LatencyMaxMs,
      @Nullable Double errorRateMaxPct) {

    public Endpoint {
      if (url == null || url.isBlank()) {
        throw new IllegalStateException("pipeline endpoint url must not be blank");
      }
    }

    public PipelineTarget target() {
      return new PipelineTarget(targetAccuracy, p95LatencyMaxMs, errorRateMaxPct);
    }
  }
}
