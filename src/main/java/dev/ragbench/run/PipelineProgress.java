package dev.ragbench.run;

import java.time.Instant;

/**
 * Immutable snapshot of one pipeline's progress within a run.
 *
 * <p>Created and updated by {@link RunProgressTracker}; each update produces a new record.
 *
 * @param pipeline pipeline name
 * @param status current status
 * @param total questions submitted for this run, skipped ones included
 * @param skipped questions skipped because they were already tested
 * @param attempted attempts recorded
 * @param correct attempts judged correct
 * @param errors attempts that carried an error
 * @param startedAt when the pipeline's worker was started
 */
public record PipelineProgress(
    String pipeline,
    Status status,
    int total,
    int skipped,
    int attempted,
    int correct,
    int errors,
    Instant startedAt) {

  public double accuracyPct() {
    return attempted == 0 ? 0.0 : correct * 100.0 / attempted;
  }

  public double errorRatePct() {
    return attempted == 0 ? 0.0 : errors * 100.0 / attempted;
  }

  /** Questions neither skipped nor attempted yet. */
  public int remaining() {
    return Math.max(0, total - skipped - attempted);
  }

  /** Worker status. */
  public enum Status {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED
  }
}
