package dev.ragbench.gate;

import dev.ragbench.config.EvaluationConfigurationException;
import dev.ragbench.ledger.Iteration;
import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.ledger.PipelineSummary;
import dev.ragbench.ledger.QuestionRegistryEntry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether a phase's criteria are met by the current ledger.
 *
 * <p>Every declared criterion is evaluated, so a failed report lists all blockers rather than the
 * first one. Accuracy criteria count each question once by its most recent run in the registry;
 * latency and error-rate criteria read the latest iteration that tested the pipeline.
 */
@Service
public class PhaseGate {

  private static final Logger log = LoggerFactory.getLogger(PhaseGate.class);

  private final GateProperties properties;

  public PhaseGate(GateProperties properties) {
    this.properties = properties;
  }

  /**
   * Checks one phase, its prerequisites included.
   *
   * @throws EvaluationConfigurationException if the phase or one of its prerequisites is not
   *     defined, or the prerequisites form a cycle
   */
  public GateReport check(int phase, LedgerSnapshot snapshot) {
    GateReport report = check(phase, snapshot, new LinkedHashSet<>());
    log.info(
        "Phase {} ({}) gate {}: {} criteria, {} blockers",
        phase,
        report.phaseName(),
        report.passed() ? "PASSED" : "NOT MET",
        report.criteria().size(),
        report.blockers().size());
    return report;
  }

  private GateReport check(int phase, LedgerSnapshot snapshot, Set<Integer> visiting) {
    PhaseDefinition definition = properties.phases().get(phase);
    if (definition == null) {
      throw new EvaluationConfigurationException("Unknown phase: " + phase);
    }
    if (!visiting.add(phase)) {
      throw new EvaluationConfigurationException(
          "Phase prerequisites form a cycle: " + visiting + " -> " + phase);
    }
    List<GateCriterion> criteria = new ArrayList<>();
    if (definition.requiresPhase() != null) {
      int required = definition.requiresPhase();
      GateReport prerequisite = check(required, snapshot, visiting);
      criteria.add(prerequisiteCriterion(required, prerequisite));
    }
    definition
        .pipelineTargets()
        .forEach((pipeline, target) -> criteria.add(accuracy(snapshot, pipeline, target)));
    if (definition.overallTarget() != null) {
      criteria.add(overallAccuracy(snapshot, definition.overallTarget()));
    }
    definition
        .p95LatencyMaxMs()
        .forEach((pipeline, ceiling) -> criteria.add(p95Latency(snapshot, pipeline, ceiling)));
    definition
        .errorRateMaxPct()
        .forEach((pipeline, ceiling) -> criteria.add(errorRate(snapshot, pipeline, ceiling)));
    if (definition.overallErrorRateMaxPct() != null) {
      criteria.add(overallErrorRate(snapshot, definition.overallErrorRateMaxPct()));
    }
    if (definition.stableIterations() > 0) {
      criteria.add(stability(snapshot, definition.stableIterations()));
    }
    visiting.remove(phase);
    boolean passed = criteria.stream().allMatch(GateCriterion::passed);
    return new GateReport(phase, definition.name(), passed, criteria);
  }

  private static GateCriterion prerequisiteCriterion(int required, GateReport prerequisite) {
    boolean met = prerequisite.passed();
    return new GateCriterion(
        "prerequisite:phase-" + required,
        CriterionKind.PREREQUISITE,
        null,
        met ? 1.0 : 0.0,
        1.0,
        GateOperator.GREATER_OR_EQUAL,
        met,
        met
            ? "Phase " + required + " gates met (prerequisite)"
            : "Phase " + required + " gates NOT met (prerequisite)");
  }

  private static GateCriterion accuracy(LedgerSnapshot snapshot, String pipeline, double target) {
    OptionalDouble current = snapshot.currentAccuracyPct(pipeline);
    String name = "accuracy:" + pipeline;
    if (current.isEmpty()) {
      return noData(
          name, CriterionKind.PIPELINE_ACCURACY, pipeline, target, GateOperator.GREATER_OR_EQUAL);
    }
    return GateCriterion.evaluate(
        name,
        CriterionKind.PIPELINE_ACCURACY,
        pipeline,
        round1(current.getAsDouble()),
        target,
        GateOperator.GREATER_OR_EQUAL,
        pipeline + " accuracy",
        "%");
  }

  private static GateCriterion overallAccuracy(LedgerSnapshot snapshot, double target) {
    int tested = 0;
    int correct = 0;
    for (QuestionRegistryEntry entry : snapshot.questionRegistry().values()) {
      tested++;
      if (entry.latestRun().correct()) {
        correct++;
      }
    }
    if (tested == 0) {
      return noData(
          "accuracy:overall",
          CriterionKind.OVERALL_ACCURACY,
          null,
          target,
          GateOperator.GREATER_OR_EQUAL);
    }
    return GateCriterion.evaluate(
        "accuracy:overall",
        CriterionKind.OVERALL_ACCURACY,
        null,
        round1(correct * 100.0 / tested),
        target,
        GateOperator.GREATER_OR_EQUAL,
        "overall accuracy",
        "%");
  }

  private static GateCriterion p95Latency(LedgerSnapshot snapshot, String pipeline, long ceiling) {
    Optional<PipelineSummary> summary = snapshot.latestSummaryFor(pipeline);
    String name = "p95-latency:" + pipeline;
    if (summary.isEmpty()) {
      return noData(name, CriterionKind.P95_LATENCY, pipeline, ceiling, GateOperator.LESS_OR_EQUAL);
    }
    return GateCriterion.evaluate(
        name,
        CriterionKind.P95_LATENCY,
        pipeline,
        summary.get().p95LatencyMs(),
        ceiling,
        GateOperator.LESS_OR_EQUAL,
        pipeline + " p95 latency",
        "ms");
  }

  private static GateCriterion errorRate(LedgerSnapshot snapshot, String pipeline, double ceiling) {
    Optional<PipelineSummary> summary = snapshot.latestSummaryFor(pipeline);
    String name = "error-rate:" + pipeline;
    if (summary.isEmpty()) {
      return noData(name, CriterionKind.ERROR_RATE, pipeline, ceiling, GateOperator.LESS_OR_EQUAL);
    }
    return GateCriterion.evaluate(
        name,
        CriterionKind.ERROR_RATE,
        pipeline,
        round1(summary.get().errorRatePct()),
        ceiling,
        GateOperator.LESS_OR_EQUAL,
        pipeline + " error rate",
        "%");
  }

  private static GateCriterion overallErrorRate(LedgerSnapshot snapshot, double ceiling) {
    Optional<Iteration> latest = snapshot.latestIteration();
    int tested = 0;
    int errors = 0;
    if (latest.isPresent()) {
      for (PipelineSummary summary : latest.get().resultsSummary().values()) {
        tested += summary.tested();
        errors += summary.errors();
      }
    }
    if (tested == 0) {
      return noData(
          "error-rate:overall",
          CriterionKind.OVERALL_ERROR_RATE,
          null,
          ceiling,
          GateOperator.LESS_OR_EQUAL);
    }
    return GateCriterion.evaluate(
        "error-rate:overall",
        CriterionKind.OVERALL_ERROR_RATE,
        null,
        round1(errors * 100.0 / tested),
        ceiling,
        GateOperator.LESS_OR_EQUAL,
        "overall error rate",
        "%");
  }

  private GateCriterion stability(LedgerSnapshot snapshot, int required) {
    int count = stableIterationCount(snapshot.iterations(), properties.stabilityTolerancePp());
    return GateCriterion.evaluate(
        "stability",
        CriterionKind.STABILITY,
        null,
        count,
        required,
        GateOperator.GREATER_OR_EQUAL,
        "consecutive stable iterations",
        "");
  }

  /**
   * Counts the trailing run of stable iterations.
   *
   * <p>Iterations without results are skipped. The latest remaining iteration counts as one; each
   * predecessor adds one as long as no pipeline summarized in both dropped by more than {@code
   * tolerancePp}.
   */
  static int stableIterationCount(List<Iteration> history, double tolerancePp) {
    List<Iteration> iterations = history.stream().filter(Iteration::hasResults).toList();
    if (iterations.isEmpty()) {
      return 0;
    }
    int count = 1;
    for (int i = iterations.size() - 1; i > 0; i--) {
      if (!isStable(iterations.get(i - 1), iterations.get(i), tolerancePp)) {
        break;
      }
      count++;
    }
    return count;
  }

  private static boolean isStable(Iteration previous, Iteration current, double tolerancePp) {
    for (Map.Entry<String, PipelineSummary> entry : current.resultsSummary().entrySet()) {
      PipelineSummary before = previous.resultsSummary().get(entry.getKey());
      if (before != null && before.accuracyPct() - entry.getValue().accuracyPct() > tolerancePp) {
        return false;
      }
    }
    return true;
  }

  private static GateCriterion noData(
      String name,
      CriterionKind kind,
      @Nullable String pipeline,
      double threshold,
      GateOperator operator) {
    String subject = pipeline == null ? name : pipeline;
    return new GateCriterion(
        name, kind, pipeline, 0.0, threshold, operator, false, subject + ": no results recorded");
  }

  private static double round1(double value) {
    return Math.round(value * 10.0) / 10.0;
  }
}
