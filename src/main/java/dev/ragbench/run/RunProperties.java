package dev.ragbench.run;

import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Run tunables, bound from {@code ragbench.run.*}.
 *
 * @param datasets dataset locations ({@code classpath:} or file paths)
 * @param checkpointInterval attempts between durable flushes, counted across pipelines
 * @param progressInterval attempts between progress callbacks
 * @param collapse early-stop thresholds
 * @param stages escalating question counts of a staged run, first stage first
 */
@ConfigurationProperties(prefix = "ragbench.run")
public record RunProperties(
    List<String> datasets,
    @DefaultValue("10") int checkpointInterval,
    @DefaultValue("10") int progressInterval,
    @DefaultValue Collapse collapse,
    List<Stage> stages) {

  private static final List<Stage> DEFAULT_STAGES =
      List.of(
          new Stage("Smoke", 5, 60.0, 40.0),
          new Stage("Quick", 10, 65.0, 20.0),
          new Stage("Full", 50, null, 10.0));

  public RunProperties {
    datasets = datasets == null ? List.of() : List.copyOf(datasets);
    if (checkpointInterval < 1) {
      throw new IllegalStateException(
          "ragbench.run.checkpoint-interval must be >= 1, got: " + checkpointInterval);
    }
    if (progressInterval < 1) {
      throw new IllegalStateException(
          "ragbench.run.progress-interval must be >= 1, got: " + progressInterval);
    }
    if (collapse == null) {
      collapse = new Collapse(true, 10, 5.0, 80.0);
    }
    stages = stages == null || stages.isEmpty() ? DEFAULT_STAGES : List.copyOf(stages);
  }

  public static RunProperties defaults() {
    return new RunProperties(List.of(), 10, 10, null, null);
  }

  /**
   * Quality-collapse detection: a pipeline with at least {@code minAttempts} attempts whose
   * accuracy falls below {@code minAccuracyPct} or whose error rate exceeds {@code
   * maxErrorRatePct} stops the run.
   */
  public record Collapse(
      @DefaultValue("true") boolean enabled,
      @DefaultValue("10") int minAttempts,
      @DefaultValue("5.0") double minAccuracyPct,
      @DefaultValue("80.0") double maxErrorRatePct) {}

  /**
   * One stage of a staged run. A pipeline advances to the next stage only when its accuracy in
   * this stage reaches {@code minAccuracyPct} and its error rate stays within {@code
   * maxErrorRatePct}.
   *
   * @param name display name
   * @param questions questions per pipeline in this stage
   * @param minAccuracyPct accuracy to advance, null to use the pipeline's own target
   * @param maxErrorRatePct highest error rate that still advances
   */
  public record Stage(
      String name,
      int questions,
      @Nullable Double minAccuracyPct,
      @DefaultValue("100.0") double maxErrorRatePct) {

    public Stage {
      if (questions < 1) {
        throw new IllegalStateException(
            "ragbench.run.stages.*.questions must be >= 1, got: " + questions);
      }
    }
  }
}
