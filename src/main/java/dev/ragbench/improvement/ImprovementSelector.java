package dev.ragbench.improvement;

import dev.ragbench.analysis.PipelineGap;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Picks the next backlog item to apply.
 *
 * <p>The pipeline farthest from its target wins before priority is considered: a P1 item for a
 * pipeline 20pp short is chosen over a P0 item for one 5pp short. Within a pipeline, items are
 * ordered by priority, then by expected impact (largest first), then by id, so the choice is
 * deterministic.
 */
@Component
public class ImprovementSelector {

  static final Comparator<Improvement> WITHIN_PIPELINE =
      Comparator.comparing(Improvement::priority)
          .thenComparing(Comparator.comparingDouble(Improvement::expectedImpactPp).reversed())
          .thenComparing(Improvement::id);

  private static final Comparator<PipelineGap> LARGEST_GAP_FIRST =
      Comparator.comparingDouble(PipelineGap::gapPp)
          .reversed()
          .thenComparing(PipelineGap::pipeline);

  /**
   * Selects the next item.
   *
   * @param backlog current backlog
   * @param gaps current gap of each pipeline
   * @param forcedPipeline restricts the choice to this pipeline when set
   */
  public Selection selectNext(
      Backlog backlog, List<PipelineGap> gaps, @Nullable String forcedPipeline) {
    List<Improvement> pending = backlog.pending();
    if (pending.isEmpty()) {
      return Selection.none(Selection.Outcome.NO_PENDING, "No pending improvements left");
    }
    if (forcedPipeline != null) {
      List<Improvement> forced = forPipeline(pending, forcedPipeline);
      if (forced.isEmpty()) {
        return Selection.none(
            Selection.Outcome.EXHAUSTED, "No pending improvements for " + forcedPipeline);
      }
      return Selection.selected(best(forced), "forced pipeline " + forcedPipeline);
    }
    List<PipelineGap> failing =
        gaps.stream().filter(PipelineGap::isFailing).sorted(LARGEST_GAP_FIRST).toList();
    for (PipelineGap gap : failing) {
      List<Improvement> candidates = forPipeline(pending, gap.pipeline());
      if (!candidates.isEmpty()) {
        return Selection.selected(
            best(candidates),
            String.format(Locale.ROOT, "%s is %.1fpp below target", gap.pipeline(), gap.gapPp()));
      }
    }
    return Selection.selected(best(pending), "no failing pipeline has a pending improvement");
  }

  private static List<Improvement> forPipeline(List<Improvement> pending, String pipeline) {
    return pending.stream().filter(i -> i.pipeline().equals(pipeline)).toList();
  }

  private static Improvement best(List<Improvement> candidates) {
    return candidates.stream().min(WITHIN_PIPELINE).orElseThrow();
  }
}
