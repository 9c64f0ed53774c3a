package dev.ragbench.run;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Caller choices for one evaluation run.
 *
 * @param maxPerPipeline maximum untested questions per pipeline, null for no limit
 * @param pipelines pipelines to run, empty for every configured pipeline with questions
 * @param reset ignore earlier progress and test every question again
 * @param label iteration label
 * @param datasets dataset locations overriding {@code ragbench.run.datasets}, empty to keep them
 * @param onlyFailing re-test only questions whose latest run failed or errored
 * @param startStage first stage of a staged run (1-based), null for a plain run
 * @param ignoreStageGate advance every pipeline through all stages whatever its results
 */
public record RunOptions(
    @Nullable Integer maxPerPipeline,
    List<String> pipelines,
    boolean reset,
    @Nullable String label,
    List<String> datasets,
    boolean onlyFailing,
    @Nullable Integer startStage,
    boolean ignoreStageGate) {

  public RunOptions {
    pipelines = pipelines == null ? List.of() : List.copyOf(pipelines);
    datasets = datasets == null ? List.of() : List.copyOf(datasets);
    if (maxPerPipeline != null && maxPerPipeline < 1) {
      throw new IllegalArgumentException("maxPerPipeline must be >= 1, got: " + maxPerPipeline);
    }
    if (startStage != null && startStage < 1) {
      throw new IllegalArgumentException("startStage must be >= 1, got: " + startStage);
    }
  }

  public RunOptions(
      @Nullable Integer maxPerPipeline,
      List<String> pipelines,
      boolean reset,
      @Nullable String label,
      List<String> datasets) {
    this(maxPerPipeline, pipelines, reset, label, datasets, false, null, false);
  }

  public static RunOptions defaults() {
    return new RunOptions(null, List.of(), false, null, List.of());
  }

  public boolean staged() {
    return startStage != null;
  }
}
