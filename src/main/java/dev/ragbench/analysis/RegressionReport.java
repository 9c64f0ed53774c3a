package dev.ragbench.analysis;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Verdict changes between the two most recent iterations.
 *
 * @param hasData false when the ledger holds fewer than two iterations
 * @param previousIteration label (or id) of the earlier iteration
 * @param currentIteration label (or id) of the latest iteration
 * @param commonQuestions questions attempted in both
 * @param regressions passed before, fail now
 * @param fixes failed before, pass now
 */
public record RegressionReport(
    boolean hasData,
    @Nullable String previousIteration,
    @Nullable String currentIteration,
    int commonQuestions,
    List<QuestionChange> regressions,
    List<QuestionChange> fixes) {

  public RegressionReport {
    regressions = List.copyOf(regressions);
    fixes = List.copyOf(fixes);
  }

  public static RegressionReport noData() {
    return new RegressionReport(false, null, null, 0, List.of(), List.of());
  }
}
