package dev.ragbench.analysis;

import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.ledger.QuestionRegistryEntry;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A question whose verdict is inconsistent across runs.
 *
 * @param questionId question id
 * @param pipeline pipeline that answers it
 * @param questionText question text, shortened
 * @param passRate registry pass rate
 * @param totalRuns runs recorded
 * @param passCount runs judged correct
 */
public record FlakyQuestion(
    String questionId,
    @Nullable String pipeline,
    String questionText,
    double passRate,
    int totalRuns,
    int passCount) {

  private static final int TEXT_PREVIEW = 80;

  /** Returns every flaky question of the registry, lowest pass rate first. */
  public static List<FlakyQuestion> findAll(LedgerSnapshot snapshot) {
    return snapshot.questionRegistry().values().stream()
        .filter(QuestionRegistryEntry::isFlaky)
        .map(FlakyQuestion::of)
        .sorted(
            Comparator.comparingDouble(FlakyQuestion::passRate)
                .thenComparing(FlakyQuestion::questionId))
        .toList();
  }

  private static FlakyQuestion of(QuestionRegistryEntry entry) {
    String text = entry.questionText();
    return new FlakyQuestion(
        entry.questionId(),
        entry.pipeline(),
        text.length() > TEXT_PREVIEW ? text.substring(0, TEXT_PREVIEW) : text,
        entry.passRate(),
        entry.totalRuns(),
        entry.passCount());
  }
}
