package dev.ragbench.improvement;

import dev.ragbench.analysis.GapAnalyzer;
import dev.ragbench.analysis.PipelineGap;
import dev.ragbench.improvement.ImprovementApplier.ApplyResult;
import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.ledger.LedgerStore;
import dev.ragbench.pipeline.PipelineProperties;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives the backlog: selects and applies the next item, and verifies applied items against the
 * ledger.
 */
@Service
public class ImprovementService {

  private static final Logger log = LoggerFactory.getLogger(ImprovementService.class);

  private final LedgerStore ledgerStore;
  private final BacklogStore backlogStore;
  private final GapAnalyzer gapAnalyzer;
  private final ImprovementSelector selector;
  private final ImprovementApplier applier;
  private final PipelineProperties pipelineProperties;
  private final BacklogProperties backlogProperties;
  private final Clock clock;

  public ImprovementService(
      LedgerStore ledgerStore,
      BacklogStore backlogStore,
      GapAnalyzer gapAnalyzer,
      ImprovementSelector selector,
      ImprovementApplier applier,
      PipelineProperties pipelineProperties,
      BacklogProperties backlogProperties,
      Clock clock) {
    this.ledgerStore = ledgerStore;
    this.backlogStore = backlogStore;
    this.gapAnalyzer = gapAnalyzer;
    this.selector = selector;
    this.applier = applier;
    this.pipelineProperties = pipelineProperties;
    this.backlogProperties = backlogProperties;
    this.clock = clock;
  }

  /**
   * What {@link #applyNext} did.
   *
   * @param selection the selection made
   * @param result the applier's report, null when nothing was applied
   * @param improvement the item after the call, null when nothing was selected
   */
  public record ApplyOutcome(
      Selection selection, @Nullable ApplyResult result, @Nullable Improvement improvement) {

    public boolean applied() {
      return result != null && result.success();
    }
  }

  /** Selects the next item without applying it. */
  public Selection selectNext(@Nullable String forcedPipeline) {
    LedgerSnapshot snapshot = ledgerStore.load();
    List<PipelineGap> gaps = gapAnalyzer.analyze(snapshot, pipelineProperties.targets());
    Selection selection = selector.selectNext(backlogStore.load(), gaps, forcedPipeline);
    log.info("Selection: {} ({})", selection.outcome(), selection.reason());
    return selection;
  }

  /**
   * Selects the next item and runs the applier on it. On success the item becomes APPLIED with
   * its pipeline's current accuracy as baseline; on failure it stays PENDING.
   */
  public ApplyOutcome applyNext(@Nullable String forcedPipeline) {
    LedgerSnapshot snapshot = ledgerStore.load();
    Backlog backlog = backlogStore.load();
    List<PipelineGap> gaps = gapAnalyzer.analyze(snapshot, pipelineProperties.targets());
    Selection selection = selector.selectNext(backlog, gaps, forcedPipeline);
    if (selection.improvement() == null) {
      log.info("Nothing to apply: {}", selection.reason());
      return new ApplyOutcome(selection, null, null);
    }
    Improvement chosen = selection.improvement();
    log.info(
        "Applying {} [{}] for {} ({})",
        chosen.id(),
        chosen.priority(),
        chosen.pipeline(),
        selection.reason());
    ApplyResult result = applier.apply(chosen);
    if (!result.success()) {
      log.warn("Applier failed for {}: {}", chosen.id(), result.message());
      return new ApplyOutcome(selection, result, chosen);
    }
    Double baseline = boxed(snapshot.currentAccuracyPct(chosen.pipeline()));
    Backlog saved = backlogStore.save(backlog.markApplied(chosen.id(), clock.instant(), baseline));
    Improvement applied = saved.find(chosen.id()).orElseThrow();
    log.info("Applied {} (baseline accuracy {})", applied.id(), baseline);
    return new ApplyOutcome(selection, result, applied);
  }

  /**
   * Verifies an applied item: its actual impact is the pipeline's current accuracy minus the
   * baseline recorded at apply time. A drop larger than the regression tolerance fails the item.
   *
   * @throws IllegalArgumentException if no item has {@code id}
   * @throws IllegalStateException if the item is not APPLIED or its impact cannot be measured
   */
  public Improvement verify(String id) {
    Backlog backlog = backlogStore.load();
    Improvement improvement =
        backlog
            .find(id)
            .orElseThrow(() -> new IllegalArgumentException("Unknown improvement: " + id));
    if (improvement.status() != ImprovementStatus.APPLIED) {
      log.warn("Cannot verify {}: status is {}", id, improvement.status());
      throw new IllegalStateException(
          "Improvement " + id + " is " + improvement.status() + ", expected APPLIED");
    }
    OptionalDouble current = ledgerStore.load().currentAccuracyPct(improvement.pipeline());
    if (improvement.baselineAccuracyPct() == null || current.isEmpty()) {
      throw new IllegalStateException(
          "Cannot measure the impact of "
              + id
              + ": no baseline or no results for "
              + improvement.pipeline());
    }
    double impact = round1(current.getAsDouble() - improvement.baselineAccuracyPct());
    Backlog updated;
    if (impact < -backlogProperties.regressionTolerancePp()) {
      String reason =
          String.format(
              Locale.ROOT,
              "accuracy dropped %.1fpp (tolerance %.1fpp)",
              -impact,
              backlogProperties.regressionTolerancePp());
      log.warn("Improvement {} failed verification: {}", id, reason);
      updated = backlog.markFailed(id, clock.instant(), impact, reason);
    } else {
      log.info("Improvement {} verified: {}pp", id, impact);
      updated = backlog.markVerified(id, clock.instant(), impact);
    }
    return backlogStore.save(updated).find(id).orElseThrow();
  }

  private static @Nullable Double boxed(OptionalDouble value) {
    return value.isPresent() ? round1(value.getAsDouble()) : null;
  }

  private static double round1(double value) {
    return Math.round(value * 10.0) / 10.0;
  }
}
