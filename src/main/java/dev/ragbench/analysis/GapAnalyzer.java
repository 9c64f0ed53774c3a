package dev.ragbench.analysis;

import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.ledger.QuestionRegistryEntry;
import dev.ragbench.pipeline.PipelineTarget;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Computes each pipeline's gap to its target.
 *
 * <p>Current accuracy counts each question once, by its most recent run in the registry, so
 * questions tested repeatedly do not weigh more. Plateau detection uses the pipeline's own
 * per-iteration accuracy series.
 */
@Component
public class GapAnalyzer {

  private final AnalysisProperties properties;

  public GapAnalyzer(AnalysisProperties properties) {
    this.properties = properties;
  }

  /**
   * Computes gaps for every pipeline that has a target.
   *
   * @param snapshot ledger to measure
   * @param targets target per pipeline
   * @return gaps, largest first, ties broken by pipeline name
   */
  public List<PipelineGap> analyze(LedgerSnapshot snapshot, Map<String, PipelineTarget> targets) {
    List<PipelineGap> gaps = new ArrayList<>(targets.size());
    targets.forEach((pipeline, target) -> gaps.add(gapOf(snapshot, pipeline, target)));
    gaps.sort(
        Comparator.comparingDouble(PipelineGap::gapPp)
            .reversed()
            .thenComparing(PipelineGap::pipeline));
    return gaps;
  }

  private PipelineGap gapOf(LedgerSnapshot snapshot, String pipeline, PipelineTarget target) {
    List<QuestionRegistryEntry> entries = snapshot.entriesFor(pipeline);
    int tested = entries.size();
    int correct = 0;
    int errors = 0;
    for (QuestionRegistryEntry entry : entries) {
      if (entry.latestRun().correct()) {
        correct++;
      }
      if (entry.latestRun().hasError()) {
        errors++;
      }
    }
    double accuracy = tested == 0 ? 0.0 : round1(correct * 100.0 / tested);
    double gap = round1(target.accuracyPct() - accuracy);
    double errorRate = tested == 0 ? 0.0 : round1(errors * 100.0 / tested);
    return new PipelineGap(
        pipeline,
        accuracy,
        target.accuracyPct(),
        gap,
        gap <= 0,
        isPlateaued(snapshot.accuracySeries(pipeline)),
        tested,
        errors,
        errorRate);
  }

  private boolean isPlateaued(List<Double> series) {
    if (series.size() < 2) {
      return false;
    }
    double last = series.get(series.size() - 1);
    double previous = series.get(series.size() - 2);
    return Math.abs(last - previous) < properties.plateauThresholdPp();
  }

  private static double round1(double value) {
    return Math.round(value * 10.0) / 10.0;
  }
}
