package dev.ragbench.pipeline;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of one question sent to one pipeline, retries included.
 *
 * <p>Failures are carried as data: {@code error} is non-null exactly when the call failed, and
 * {@code answer} then holds whatever best-effort text was recovered (often empty).
 *
 * @param answer extracted answer text, never null
 * @param latencyMs end-to-end latency including retries and backoff
 * @param error human-readable error, null on success
 * @param errorType classification of {@code error}, null on success
 * @param httpStatus last HTTP status received, null if no response arrived
 * @param attempts number of HTTP attempts made
 */
public record PipelineCallResult(
    String answer,
    long latencyMs,
    @Nullable String error,
    @Nullable ErrorType errorType,
    @Nullable Integer httpStatus,
    int attempts) {

  public PipelineCallResult {
    answer = answer == null ? "" : answer;
    if ((error == null) != (errorType == null)) {
      throw new IllegalArgumentException("error and errorType must both be set or both be null");
    }
  }

  public static PipelineCallResult success(
      String answer, long latencyMs, int httpStatus, int attempts) {
    return new PipelineCallResult(answer, latencyMs, null, null, httpStatus, attempts);
  }

  public static PipelineCallResult failure(
      String answer,
      long latencyMs,
      String error,
      ErrorType errorType,
      @Nullable Integer httpStatus,
      int attempts) {
    return new PipelineCallResult(answer, latencyMs, error, errorType, httpStatus, attempts);
  }

  public PipelineCallResult withLatency(long latencyMs) {
    return new PipelineCallResult(answer, latencyMs, error, errorType, httpStatus, attempts);
  }

  public boolean isError() {
    return error != null;
  }
}
