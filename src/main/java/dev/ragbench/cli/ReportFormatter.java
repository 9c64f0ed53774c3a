package dev.ragbench.cli;

import dev.ragbench.analysis.AnalysisReport;
import dev.ragbench.analysis.ErrorPattern;
import dev.ragbench.analysis.FlakyQuestion;
import dev.ragbench.analysis.PipelineGap;
import dev.ragbench.analysis.QuestionChange;
import dev.ragbench.analysis.RegressionReport;
import dev.ragbench.analysis.Suggestion;
import dev.ragbench.gate.GateCriterion;
import dev.ragbench.gate.GateReport;
import dev.ragbench.improvement.Improvement;
import dev.ragbench.improvement.ImprovementService.ApplyOutcome;
import dev.ragbench.improvement.Selection;
import dev.ragbench.run.PipelineProgress;
import dev.ragbench.run.RunOutcome;
import dev.ragbench.run.StageResult;
import dev.ragbench.run.StageVerdict;
import dev.ragbench.run.StagedRunOutcome;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/** Renders command results as plain text for the terminal. */
@Component
public class ReportFormatter {

  private static final int MAX_LISTED = 10;

  public String format(RunOutcome outcome) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            Locale.ROOT,
            "Iteration %s (#%d)%s, %d checkpoints\n",
            outcome.iteration().id(),
            outcome.iteration().sequenceNumber(),
            outcome.cancelled() ? " CANCELLED" : "",
            outcome.checkpoints()));
    Map<String, PipelineProgress> progress = new TreeMap<>(outcome.progress());
    for (PipelineProgress p : progress.values()) {
      sb.append(
          String.format(
              Locale.ROOT,
              "  %-14s %-9s attempted=%d succeeded=%d errored=%d skipped=%d accuracy=%.1f%%\n",
              p.pipeline(),
              p.status(),
              p.attempted(),
              p.attempted() - p.errors(),
              p.errors(),
              p.skipped(),
              p.accuracyPct()));
    }
    outcome
        .iteration()
        .resultsSummary()
        .forEach(
            (pipeline, summary) ->
                sb.append(
                    String.format(
                        Locale.ROOT,
                        "  %-14s latency avg=%dms p50=%dms p95=%dms, avg F1=%.4f\n",
                        pipeline,
                        summary.avgLatencyMs(),
                        summary.p50LatencyMs(),
                        summary.p95LatencyMs(),
                        summary.avgScore())));
    return sb.toString();
  }

  public String format(StagedRunOutcome outcome) {
    if (outcome.stages().isEmpty()) {
      return "No stage was run\n";
    }
    StringBuilder sb = new StringBuilder();
    for (StageResult stage : outcome.stages()) {
      sb.append(String.format(Locale.ROOT, "Stage %d: %s\n", stage.number(), stage.name()));
      for (StageVerdict verdict : stage.verdicts().values()) {
        sb.append(
            String.format(
                Locale.ROOT,
                "  %-14s %-8s tested=%d accuracy=%.1f%% (min %.1f%%) errors=%.1f%% (max %.1f%%)",
                verdict.pipeline(),
                verdict.passed() ? "ADVANCE" : "BLOCKED",
                verdict.tested(),
                verdict.accuracyPct(),
                verdict.minAccuracyPct(),
                verdict.errorRatePct(),
                verdict.maxErrorRatePct()));
        if (!verdict.passed()) {
          sb.append(": ").append(verdict.reason());
        }
        sb.append('\n');
      }
    }
    if (outcome.cancelled()) {
      sb.append("Staged run CANCELLED\n");
    }
    return sb.toString();
  }

  public String format(AnalysisReport report) {
    StringBuilder sb = new StringBuilder();
    sb.append("Analysis of ledger revision ").append(report.ledgerRevision()).append('\n');
    sb.append("\nPipeline gaps:\n");
    for (PipelineGap gap : report.gaps()) {
      sb.append(
          String.format(
              Locale.ROOT,
              "  %-14s %5.1f%% / %5.1f%%  gap %+.1fpp  errors %.1f%%%s\n",
              gap.pipeline(),
              gap.currentAccuracyPct(),
              gap.targetAccuracyPct(),
              gap.gapPp(),
              gap.errorRatePct(),
              gap.plateaued() ? "  (plateau)" : ""));
    }
    appendRegressions(sb, report.regressions());
    if (!report.errorPatterns().isEmpty()) {
      sb.append("\nError patterns (latest iteration):\n");
      for (ErrorPattern pattern : report.errorPatterns()) {
        sb.append(
            String.format(
                Locale.ROOT,
                "  [%s] %s x%d in %s\n",
                pattern.severity(),
                pattern.errorType(),
                pattern.count(),
                String.join(",", new TreeSet<>(pattern.pipelines()))));
      }
    }
    if (!report.flakyQuestions().isEmpty()) {
      sb.append("\nFlaky questions: ").append(report.flakyQuestions().size()).append('\n');
      report.flakyQuestions().stream()
          .limit(MAX_LISTED)
          .forEach(f -> sb.append(formatFlaky(f)));
    }
    sb.append("\nSuggestions:\n");
    if (report.suggestions().isEmpty()) {
      sb.append("  none\n");
    }
    for (Suggestion suggestion : report.suggestions()) {
      sb.append("  [")
          .append(suggestion.severity())
          .append("] ")
          .append(suggestion.area())
          .append(": ")
          .append(suggestion.text())
          .append(" (")
          .append(suggestion.evidence())
          .append(")\n");
    }
    return sb.toString();
  }

  public String format(GateReport report) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            Locale.ROOT,
            "Phase %d: %s\nStatus: %s\n",
            report.phase(),
            report.phaseName(),
            report.passed() ? "PASSED" : "NOT MET"));
    for (GateCriterion criterion : report.criteria()) {
      sb.append("  ")
          .append(criterion.passed() ? "[x] " : "[ ] ")
          .append(criterion.message())
          .append('\n');
    }
    if (!report.passed()) {
      sb.append("Blockers:\n");
      report.blockers().forEach(b -> sb.append("  - ").append(b).append('\n'));
    }
    return sb.toString();
  }

  public String format(Selection selection) {
    if (selection.improvement() == null) {
      return selection.outcome() + ": " + selection.reason() + "\n";
    }
    return "Next improvement (" + selection.reason() + "):\n" + describe(selection.improvement());
  }

  public String format(ApplyOutcome outcome) {
    if (outcome.result() == null) {
      return format(outcome.selection());
    }
    String verdict = outcome.applied() ? "APPLIED" : "APPLY FAILED";
    StringBuilder sb = new StringBuilder(verdict).append(": ");
    sb.append(outcome.result().message()).append('\n');
    if (outcome.improvement() != null) {
      sb.append(describe(outcome.improvement()));
    }
    return sb.toString();
  }

  public String format(Improvement improvement) {
    return describe(improvement);
  }

  private static void appendRegressions(StringBuilder sb, RegressionReport regressions) {
    if (!regressions.hasData()) {
      sb.append("\nRegressions: fewer than two iterations recorded\n");
      return;
    }
    sb.append(
        String.format(
            Locale.ROOT,
            "\nRegressions %s -> %s: %d regressed, %d fixed over %d common questions\n",
            regressions.previousIteration(),
            regressions.currentIteration(),
            regressions.regressions().size(),
            regressions.fixes().size(),
            regressions.commonQuestions()));
    regressions.regressions().stream()
        .limit(MAX_LISTED)
        .forEach(change -> sb.append(formatChange("-", change)));
    regressions.fixes().stream()
        .limit(MAX_LISTED)
        .forEach(change -> sb.append(formatChange("+", change)));
  }

  private static String formatChange(String marker, QuestionChange change) {
    return String.format(
        Locale.ROOT,
        "  %s %s (%s) F1 %.2f -> %.2f%s\n",
        marker,
        change.questionId(),
        change.pipeline(),
        change.previousScore(),
        change.currentScore(),
        change.errorType() == null ? "" : " " + change.errorType());
  }

  private static String formatFlaky(FlakyQuestion flaky) {
    return String.format(
        Locale.ROOT,
        "  %s (%s) pass rate %.2f over %d runs: %s\n",
        flaky.questionId(),
        flaky.pipeline(),
        flaky.passRate(),
        flaky.totalRuns(),
        flaky.questionText());
  }

  private static String describe(Improvement improvement) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            Locale.ROOT,
            "  %s [%s] %s for %s, expected +%.1fpp\n",
            improvement.id(),
            improvement.priority(),
            improvement.status(),
            improvement.pipeline(),
            improvement.expectedImpactPp()));
    if (improvement.title() != null) {
      sb.append("  ").append(improvement.title()).append('\n');
    }
    if (improvement.actualImpactPp() != null) {
      sb.append(
          String.format(Locale.ROOT, "  actual impact %+.1fpp\n", improvement.actualImpactPp()));
    }
    if (improvement.failureReason() != null) {
      sb.append("  failed: ").append(improvement.failureReason()).append('\n');
    }
    return sb.toString();
  }
}
