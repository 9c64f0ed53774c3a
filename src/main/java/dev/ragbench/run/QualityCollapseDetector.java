package dev.ragbench.run;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stops a run early when a pipeline's quality has collapsed, so that a broken deployment does not
 * burn through the whole dataset.
 */
public class QualityCollapseDetector implements RunProgressListener {

  private static final Logger log = LoggerFactory.getLogger(QualityCollapseDetector.class);

  private final RunProperties.Collapse thresholds;

  public QualityCollapseDetector(RunProperties.Collapse thresholds) {
    this.thresholds = thresholds;
  }

  @Override
  public ProgressDecision onProgress(int attempts, Map<String, PipelineProgress> progress) {
    if (!thresholds.enabled()) {
      return ProgressDecision.CONTINUE;
    }
    for (PipelineProgress pipeline : progress.values()) {
      if (pipeline.attempted() < thresholds.minAttempts()) {
        continue;
      }
      if (pipeline.accuracyPct() < thresholds.minAccuracyPct()) {
        log.warn(
            "Quality collapse on {}: accuracy {}% after {} attempts (minimum {}%)",
            pipeline.pipeline(),
            String.format("%.1f", pipeline.accuracyPct()),
            pipeline.attempted(),
            thresholds.minAccuracyPct());
        return ProgressDecision.STOP;
      }
      if (pipeline.errorRatePct() > thresholds.maxErrorRatePct()) {
        log.warn(
            "Quality collapse on {}: error rate {}% after {} attempts (maximum {}%)",
            pipeline.pipeline(),
            String.format("%.1f", pipeline.errorRatePct()),
            pipeline.attempted(),
            thresholds.maxErrorRatePct());
        return ProgressDecision.STOP;
      }
    }
    return ProgressDecision.CONTINUE;
  }
}
