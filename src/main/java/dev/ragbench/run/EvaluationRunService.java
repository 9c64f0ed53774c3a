package dev.ragbench.run;

import dev.ragbench.config.EvaluationConfigurationException;
import dev.ragbench.ledger.Attempt;
import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.ledger.LedgerStore;
import dev.ragbench.ledger.PipelineSummary;
import dev.ragbench.ledger.QuestionRegistryEntry;
import dev.ragbench.ledger.QuestionStatus;
import dev.ragbench.ledger.RunState;
import dev.ragbench.pipeline.PipelineProperties;
import dev.ragbench.question.Question;
import dev.ragbench.question.QuestionDatasetLoader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Prepares and executes an evaluation run: loads datasets and the ledger, validates the request,
 * picks the run state and hands the questions to the {@link RunCoordinator}.
 *
 * <p>Every configuration problem is reported before a single pipeline call is made. Besides plain
 * resumable runs it offers re-testing of failing questions only, and staged runs that grow the
 * question count per pipeline while the pipeline keeps meeting each stage's thresholds.
 */
@Service
public class EvaluationRunService {

  private static final Logger log = LoggerFactory.getLogger(EvaluationRunService.class);

  private static final double DEFAULT_TARGET_PCT = 70.0;

  private final QuestionDatasetLoader datasetLoader;
  private final LedgerStore ledgerStore;
  private final RunCoordinator runCoordinator;
  private final PipelineProperties pipelineProperties;
  private final RunProperties runProperties;

  public EvaluationRunService(
      QuestionDatasetLoader datasetLoader,
      LedgerStore ledgerStore,
      RunCoordinator runCoordinator,
      PipelineProperties pipelineProperties,
      RunProperties runProperties) {
    this.datasetLoader = datasetLoader;
    this.ledgerStore = ledgerStore;
    this.runCoordinator = runCoordinator;
    this.pipelineProperties = pipelineProperties;
    this.runProperties = runProperties;
  }

  /**
   * Runs an evaluation.
   *
   * @param options limits, pipeline subset, reset and only-failing flags, label
   * @return the run outcome
   * @throws EvaluationConfigurationException for unknown pipelines, missing or empty datasets
   * @throws dev.ragbench.ledger.LedgerStorageException if the ledger cannot be read or written
   */
  public RunOutcome run(RunOptions options) {
    if (options.staged()) {
      throw new IllegalArgumentException("Staged options must go through runStaged");
    }
    Map<String, List<Question>> selected = loadQuestions(options);

    LedgerSnapshot baseline = ledgerStore.load();
    RunState runState = options.reset() ? RunState.empty() : baseline.effectiveRunState();
    if (options.reset()) {
      log.info(
          "Ignoring {} previously tested question(s)",
          baseline.effectiveRunState().totalTested());
    }
    if (options.onlyFailing()) {
      selected = failingOnly(selected, baseline);
      runState = retest(runState, selected);
    }
    Map<String, List<Question>> limited = limit(selected, runState, options.maxPerPipeline());

    RunOutcome outcome =
        runCoordinator.run(
            new RunRequest(limited, runState, options.label(), baseline),
            new QualityCollapseDetector(runProperties.collapse()));
    report(outcome);
    return outcome;
  }

  /**
   * Runs the configured stages one after another, each with more questions per pipeline.
   *
   * <p>Every stage re-tests its questions: failures of the previous stage first, then questions
   * whose latest run failed, then untested ones, then passing ones. A pipeline that misses a
   * stage's thresholds does not take part in later stages unless {@link
   * RunOptions#ignoreStageGate()} is set; other pipelines are not held back.
   *
   * @param options staged options, {@link RunOptions#startStage()} must be set
   * @return every executed stage with its verdicts
   * @throws EvaluationConfigurationException for an undefined start stage, unknown pipelines or
   *     missing datasets
   */
  public StagedRunOutcome runStaged(RunOptions options) {
    Integer startStage = options.startStage();
    if (startStage == null) {
      throw new IllegalArgumentException("A staged run needs a start stage");
    }
    List<RunProperties.Stage> stages = runProperties.stages();
    if (startStage > stages.size()) {
      throw new EvaluationConfigurationException(
          "Stage " + startStage + " is not defined, configured stages: 1.." + stages.size());
    }
    Map<String, List<Question>> selected = loadQuestions(options);
    LedgerSnapshot ledger = ledgerStore.load();
    Set<String> active = new LinkedHashSet<>(selected.keySet());
    Map<String, Set<String>> previousFailures = new HashMap<>();
    List<StageResult> results = new ArrayList<>();

    for (int number = startStage; number <= stages.size() && !active.isEmpty(); number++) {
      RunProperties.Stage stage = stages.get(number - 1);
      int size =
          options.maxPerPipeline() == null
              ? stage.questions()
              : Math.min(stage.questions(), options.maxPerPipeline());
      Map<String, List<Question>> batch = new LinkedHashMap<>();
      RunState runState = ledger.effectiveRunState();
      for (String pipeline : active) {
        List<Question> picked =
            pickForStage(
                selected.get(pipeline),
                ledger,
                previousFailures.getOrDefault(pipeline, Set.of()),
                options.onlyFailing(),
                size);
        batch.put(pipeline, picked);
        runState = runState.without(pipeline, ids(picked));
      }
      log.info("Stage {} ({}): {} question(s) for {}", number, stage.name(), size, active);

      RunOutcome outcome =
          runCoordinator.run(
              new RunRequest(batch, runState, stageLabel(options.label(), number, stage), ledger),
              new QualityCollapseDetector(runProperties.collapse()));
      report(outcome);

      Map<String, StageVerdict> verdicts = new LinkedHashMap<>();
      for (String pipeline : batch.keySet()) {
        StageVerdict verdict = judge(stage, pipeline, outcome);
        verdicts.put(pipeline, verdict);
        previousFailures.put(pipeline, failedIds(outcome, pipeline));
        log.info(
            "Stage {} {}: {}",
            number,
            pipeline,
            verdict.passed() ? "advancing" : "blocked, " + verdict.reason());
      }
      results.add(new StageResult(number, stage.name(), outcome, verdicts));
      ledger = outcome.ledger();
      if (outcome.cancelled()) {
        log.warn("Staged run stopped during stage {}", number);
        break;
      }
      if (!options.ignoreStageGate()) {
        active.removeIf(pipeline -> !verdicts.get(pipeline).passed());
      }
    }
    return new StagedRunOutcome(results);
  }

  private Map<String, List<Question>> loadQuestions(RunOptions options) {
    List<String> datasets =
        options.datasets().isEmpty() ? runProperties.datasets() : options.datasets();
    if (datasets.isEmpty()) {
      throw new EvaluationConfigurationException("No dataset configured (ragbench.run.datasets)");
    }
    Map<String, List<Question>> loaded = datasetLoader.load(datasets);
    return selectPipelines(loaded, options.pipelines());
  }

  /** Keeps the questions whose latest recorded run failed or errored. */
  private static Map<String, List<Question>> failingOnly(
      Map<String, List<Question>> selected, LedgerSnapshot baseline) {
    Map<String, List<Question>> failing = new LinkedHashMap<>();
    selected.forEach(
        (pipeline, questions) -> {
          List<Question> kept =
              questions.stream().filter(q -> isFailing(baseline, q.id())).toList();
          log.info("Pipeline {}: {} failing question(s) to re-test", pipeline, kept.size());
          failing.put(pipeline, kept);
        });
    return failing;
  }

  private static boolean isFailing(LedgerSnapshot ledger, String questionId) {
    QuestionRegistryEntry entry = ledger.questionRegistry().get(questionId);
    return entry != null && entry.currentStatus() != QuestionStatus.PASS;
  }

  private static RunState retest(RunState runState, Map<String, List<Question>> questions) {
    RunState reduced = runState;
    for (Map.Entry<String, List<Question>> entry : questions.entrySet()) {
      reduced = reduced.without(entry.getKey(), ids(entry.getValue()));
    }
    return reduced;
  }

  private static List<Question> pickForStage(
      List<Question> questions,
      LedgerSnapshot ledger,
      Set<String> previousFailures,
      boolean onlyFailing,
      int size) {
    List<Question> previous = new ArrayList<>();
    List<Question> failing = new ArrayList<>();
    List<Question> untested = new ArrayList<>();
    List<Question> passing = new ArrayList<>();
    for (Question question : questions) {
      QuestionRegistryEntry entry = ledger.questionRegistry().get(question.id());
      if (previousFailures.contains(question.id())) {
        previous.add(question);
      } else if (entry == null) {
        untested.add(question);
      } else if (entry.currentStatus() == QuestionStatus.PASS) {
        passing.add(question);
      } else {
        failing.add(question);
      }
    }
    List<Question> ordered = new ArrayList<>(previous);
    ordered.addAll(failing);
    if (!onlyFailing) {
      ordered.addAll(untested);
      ordered.addAll(passing);
    }
    return List.copyOf(ordered.subList(0, Math.min(size, ordered.size())));
  }

  private StageVerdict judge(RunProperties.Stage stage, String pipeline, RunOutcome outcome) {
    double minAccuracy =
        stage.minAccuracyPct() != null ? stage.minAccuracyPct() : targetAccuracy(pipeline);
    PipelineSummary summary = outcome.iteration().summaryFor(pipeline).orElse(null);
    if (summary == null || summary.tested() == 0) {
      return new StageVerdict(
          pipeline, 0, 0.0, 0.0, minAccuracy, stage.maxErrorRatePct(), false, "no results");
    }
    List<String> reasons = new ArrayList<>();
    if (summary.accuracyPct() < minAccuracy) {
      reasons.add(
          String.format(
              Locale.ROOT, "accuracy %.1f%% < %.1f%%", summary.accuracyPct(), minAccuracy));
    }
    if (summary.errorRatePct() > stage.maxErrorRatePct()) {
      reasons.add(
          String.format(
              Locale.ROOT,
              "error rate %.1f%% > %.1f%%",
              summary.errorRatePct(),
              stage.maxErrorRatePct()));
    }
    return new StageVerdict(
        pipeline,
        summary.tested(),
        summary.accuracyPct(),
        summary.errorRatePct(),
        minAccuracy,
        stage.maxErrorRatePct(),
        reasons.isEmpty(),
        reasons.isEmpty() ? "all checks passed" : String.join("; ", reasons));
  }

  private double targetAccuracy(String pipeline) {
    PipelineProperties.Endpoint endpoint = pipelineProperties.endpoint(pipeline);
    return endpoint == null ? DEFAULT_TARGET_PCT : endpoint.targetAccuracy();
  }

  private static Set<String> failedIds(RunOutcome outcome, String pipeline) {
    Set<String> failed = new HashSet<>();
    for (Attempt attempt : outcome.iteration().attempts()) {
      if (pipeline.equals(attempt.pipeline()) && !attempt.correct()) {
        failed.add(attempt.questionId());
      }
    }
    return failed;
  }

  private static String stageLabel(@Nullable String label, int number, RunProperties.Stage stage) {
    String base = label == null ? "staged" : label;
    return base + " [stage " + number + ": " + stage.name() + "]";
  }

  private static List<String> ids(List<Question> questions) {
    return questions.stream().map(Question::id).toList();
  }

  private Map<String, List<Question>> selectPipelines(
      Map<String, List<Question>> loaded, List<String> requested) {
    Map<String, List<Question>> selected = new LinkedHashMap<>();
    if (requested.isEmpty()) {
      loaded.forEach(
          (pipeline, questions) -> {
            if (pipelineProperties.endpoint(pipeline) == null) {
              log.warn(
                  "Skipping {} question(s) for unconfigured pipeline {}",
                  questions.size(),
                  pipeline);
            } else {
              selected.put(pipeline, questions);
            }
          });
      if (selected.isEmpty()) {
        throw new EvaluationConfigurationException(
            "No dataset question targets a configured pipeline "
                + pipelineProperties.endpoints().keySet());
      }
      return selected;
    }
    for (String pipeline : requested) {
      if (pipelineProperties.endpoint(pipeline) == null) {
        throw new EvaluationConfigurationException(
            "Unknown pipeline '"
                + pipeline
                + "', configured: "
                + pipelineProperties.endpoints().keySet());
      }
      List<Question> questions = loaded.getOrDefault(pipeline, List.of());
      if (questions.isEmpty()) {
        throw new EvaluationConfigurationException(
            "Dataset has no question for pipeline " + pipeline);
      }
      selected.put(pipeline, questions);
    }
    return selected;
  }

  private static Map<String, List<Question>> limit(
      Map<String, List<Question>> selected, RunState runState, @Nullable Integer maxPerPipeline) {
    if (maxPerPipeline == null) {
      return selected;
    }
    Map<String, List<Question>> limited = new LinkedHashMap<>();
    selected.forEach(
        (pipeline, questions) -> {
          List<Question> untested = new ArrayList<>();
          for (Question question : questions) {
            if (untested.size() == maxPerPipeline) {
              break;
            }
            if (!runState.isTested(pipeline, question.id())) {
              untested.add(question);
            }
          }
          limited.put(pipeline, untested);
        });
    return limited;
  }

  private static void report(RunOutcome outcome) {
    outcome
        .progress()
        .values()
        .forEach(
            progress -> {
              PipelineSummary summary =
                  outcome.iteration().summaryFor(progress.pipeline()).orElse(null);
              log.info(
                  "{}: attempted={} succeeded={} errored={} accuracy={}% skipped={} status={}",
                  progress.pipeline(),
                  progress.attempted(),
                  progress.correct(),
                  progress.errors(),
                  summary == null ? "n/a" : summary.accuracyPct(),
                  progress.skipped(),
                  progress.status());
            });
  }
}
