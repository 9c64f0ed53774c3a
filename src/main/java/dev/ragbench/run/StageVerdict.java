package dev.ragbench.run;

/**
 * Whether one pipeline may advance past a stage.
 *
 * @param pipeline pipeline name
 * @param tested attempts in the stage
 * @param accuracyPct stage accuracy in percent
 * @param errorRatePct stage error rate in percent
 * @param minAccuracyPct accuracy required to advance
 * @param maxErrorRatePct highest error rate that still advances
 * @param passed true when both thresholds hold
 * @param reason why the pipeline is blocked, or {@code "all checks passed"}
 */
public record StageVerdict(
    String pipeline,
    int tested,
    double accuracyPct,
    double errorRatePct,
    double minAccuracyPct,
    double maxErrorRatePct,
    boolean passed,
    String reason) {}
