package dev.ragbench.analysis;

import dev.ragbench.ledger.Attempt;
import dev.ragbench.ledger.Iteration;
import dev.ragbench.ledger.LedgerSnapshot;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Compares the two most recent iterations question by question.
 *
 * <p>Only those two iterations are considered; longer-range drift is the registry's trend.
 */
@Component
public class RegressionAnalyzer {

  private static final int ANSWER_PREVIEW = 100;

  public RegressionReport analyze(LedgerSnapshot snapshot) {
    List<Iteration> iterations = snapshot.evaluatedIterations();
    if (iterations.size() < 2) {
      return RegressionReport.noData();
    }
    Iteration previous = iterations.get(iterations.size() - 2);
    Iteration current = iterations.get(iterations.size() - 1);
    Map<String, Attempt> previousById = byQuestion(previous);
    Map<String, Attempt> currentById = byQuestion(current);

    List<QuestionChange> regressions = new ArrayList<>();
    List<QuestionChange> fixes = new ArrayList<>();
    int common = 0;
    for (Map.Entry<String, Attempt> entry : currentById.entrySet()) {
      Attempt before = previousById.get(entry.getKey());
      if (before == null) {
        continue;
      }
      common++;
      Attempt after = entry.getValue();
      if (before.correct() && !after.correct()) {
        regressions.add(change(entry.getKey(), before, after));
      } else if (!before.correct() && after.correct()) {
        fixes.add(change(entry.getKey(), before, after));
      }
    }
    return new RegressionReport(
        true, labelOf(previous), labelOf(current), common, regressions, fixes);
  }

  /** Last attempt per question id, in first-seen order. */
  private static Map<String, Attempt> byQuestion(Iteration iteration) {
    Map<String, Attempt> byId = new LinkedHashMap<>();
    for (Attempt attempt : iteration.attempts()) {
      if (attempt.questionId() != null) {
        byId.put(attempt.questionId(), attempt);
      }
    }
    return byId;
  }

  private static QuestionChange change(String questionId, Attempt before, Attempt after) {
    return new QuestionChange(
        questionId,
        after.pipeline(),
        before.score(),
        after.score(),
        after.error(),
        after.errorType(),
        preview(before.producedAnswer()),
        preview(after.producedAnswer()));
  }

  private static String labelOf(Iteration iteration) {
    return iteration.label() == null || iteration.label().isBlank()
        ? iteration.id()
        : iteration.label();
  }

  private static String preview(String answer) {
    return answer.length() > ANSWER_PREVIEW ? answer.substring(0, ANSWER_PREVIEW) : answer;
  }
}
