package dev.ragbench.analysis;

/**
 * Distance between a pipeline's current accuracy and its target.
 *
 * @param pipeline pipeline name
 * @param currentAccuracyPct accuracy over each question's latest run, one decimal
 * @param targetAccuracyPct configured target
 * @param gapPp target minus current, in percentage points, one decimal
 * @param onTarget true when the gap is zero or negative
 * @param plateaued true when the two latest accuracy points differ by less than the threshold
 * @param tested registry entries of the pipeline
 * @param errors entries whose latest run errored
 * @param errorRatePct errors over tested in percent, one decimal
 */
public record PipelineGap(
    String pipeline,
    double currentAccuracyPct,
    double targetAccuracyPct,
    double gapPp,
    boolean onTarget,
    boolean plateaued,
    int tested,
    int errors,
    double errorRatePct) {

  /** True when the pipeline is below target. */
  public boolean isFailing() {
    return gapPp > 0;
  }
}
