package dev.ragbench.run;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe progress of one run, per pipeline.
 *
 * <p>Maintains a {@link ConcurrentHashMap} of {@link PipelineProgress} snapshots keyed by
 * pipeline. Each update atomically replaces the pipeline's record with a new immutable one using
 * {@code computeIfPresent()}. One tracker is created per run.
 */
public class RunProgressTracker {

  private final ConcurrentHashMap<String, PipelineProgress> pipelines = new ConcurrentHashMap<>();
  private final Clock clock;

  public RunProgressTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Starts tracking a pipeline.
   *
   * @param pipeline pipeline name
   * @param total questions submitted
   * @param skipped questions skipped as already tested
   */
  public void start(String pipeline, int total, int skipped) {
    pipelines.put(
        pipeline,
        new PipelineProgress(
            pipeline, PipelineProgress.Status.RUNNING, total, skipped, 0, 0, 0, clock.instant()));
  }

  /** Records one attempt's outcome. */
  public void recordAttempt(String pipeline, boolean correct, boolean errored) {
    pipelines.computeIfPresent(
        pipeline,
        (name, progress) ->
            new PipelineProgress(
                name,
                progress.status(),
                progress.total(),
                progress.skipped(),
                progress.attempted() + 1,
                progress.correct() + (correct ? 1 : 0),
                progress.errors() + (errored ? 1 : 0),
                progress.startedAt()));
  }

  public void complete(String pipeline) {
    transition(pipeline, PipelineProgress.Status.COMPLETED);
  }

  public void cancel(String pipeline) {
    transition(pipeline, PipelineProgress.Status.CANCELLED);
  }

  public void fail(String pipeline) {
    transition(pipeline, PipelineProgress.Status.FAILED);
  }

  public Optional<PipelineProgress> getProgress(String pipeline) {
    return Optional.ofNullable(pipelines.get(pipeline));
  }

  /** Returns the current progress of every pipeline, ordered by name. */
  public Map<String, PipelineProgress> snapshot() {
    Map<String, PipelineProgress> ordered = new LinkedHashMap<>();
    pipelines.keySet().stream().sorted().forEach(name -> ordered.put(name, pipelines.get(name)));
    return Collections.unmodifiableMap(ordered);
  }

  public int totalAttempted() {
    return pipelines.values().stream().mapToInt(PipelineProgress::attempted).sum();
  }

  private void transition(String pipeline, PipelineProgress.Status status) {
    pipelines.computeIfPresent(
        pipeline,
        (name, progress) ->
            new PipelineProgress(
                name,
                status,
                progress.total(),
                progress.skipped(),
                progress.attempted(),
                progress.correct(),
                progress.errors(),
                progress.startedAt()));
  }
}
