package dev.ragbench.ledger;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Cross-iteration history of one question.
 *
 * <p>Every derived field is recomputed from {@code runs}: on {@link #withRun(Attempt)} and when
 * read back from JSON, so stored values from older ledgers never disagree with the runs. Runs are
 * only ever appended.
 *
 * @param questionId question id
 * @param pipeline pipeline the question targets
 * @param questionText question text
 * @param expectedAnswer reference answer
 * @param runs attempts in recording order, never empty
 * @param passCount runs judged correct
 * @param passRate passCount over runs, three decimals
 * @param currentStatus outcome of the last run
 * @param trend first run versus last run
 * @param bestScore highest F1 seen
 * @param lastTestedAt timestamp of the last run
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuestionRegistryEntry(
    String questionId,
    @Nullable String pipeline,
    String questionText,
    String expectedAnswer,
    List<Attempt> runs,
    int passCount,
    double passRate,
    QuestionStatus currentStatus,
    Trend trend,
    double bestScore,
    @Nullable Instant lastTestedAt) {

  private static final double FLAKY_LOWER = 0.1;
  private static final double FLAKY_UPPER = 0.9;

  public QuestionRegistryEntry {
    runs = List.copyOf(runs);
    if (runs.isEmpty()) {
      throw new IllegalArgumentException("registry entry " + questionId + " has no runs");
    }
  }

  /**
   * Builds an entry from its runs, deriving every summary field.
   *
   * @throws IllegalArgumentException if {@code runs} is empty
   */
  @JsonCreator
  public static QuestionRegistryEntry of(
      @JsonProperty("questionId") @JsonAlias("id") String questionId,
      @JsonProperty("pipeline") @JsonAlias("rag_type") @Nullable String pipeline,
      @JsonProperty("questionText") @JsonAlias("question") @Nullable String questionText,
      @JsonProperty("expectedAnswer") @JsonAlias("expected") @Nullable String expectedAnswer,
      @JsonProperty("runs") List<Attempt> runs) {
    if (runs == null || runs.isEmpty()) {
      throw new IllegalArgumentException("registry entry " + questionId + " has no runs");
    }
    List<Attempt> filled = new ArrayList<>(runs.size());
    for (Attempt run : runs) {
      filled.add(run.withDefaults(questionId, pipeline));
    }

    int passCount = 0;
    double bestScore = 0.0;
    for (Attempt run : filled) {
      if (run.correct()) {
        passCount++;
      }
      bestScore = Math.max(bestScore, run.score());
    }
    Attempt first = filled.get(0);
    Attempt last = filled.get(filled.size() - 1);
    return new QuestionRegistryEntry(
        questionId,
        pipeline,
        questionText == null ? "" : questionText,
        expectedAnswer == null ? "" : expectedAnswer,
        filled,
        passCount,
        IterationSummaries.round((double) passCount / filled.size(), 3),
        statusOf(last),
        trendOf(first, last, filled.size()),
        bestScore,
        last.timestamp());
  }

  /** Starts the history of a question with its first run. */
  public static QuestionRegistryEntry first(
      String questionId,
      @Nullable String pipeline,
      String questionText,
      String expectedAnswer,
      Attempt run) {
    return of(questionId, pipeline, questionText, expectedAnswer, List.of(run));
  }

  /** Returns a new entry with {@code run} appended and every derived field recomputed. */
  public QuestionRegistryEntry withRun(Attempt run) {
    List<Attempt> appended = new ArrayList<>(runs.size() + 1);
    appended.addAll(runs);
    appended.add(run);
    return of(questionId, pipeline, questionText, expectedAnswer, appended);
  }

  public Attempt latestRun() {
    return runs.get(runs.size() - 1);
  }

  public int totalRuns() {
    return runs.size();
  }

  /** At least two runs and a pass rate strictly between 10% and 90%. */
  @JsonIgnore
  public boolean isFlaky() {
    return runs.size() >= 2 && passRate > FLAKY_LOWER && passRate < FLAKY_UPPER;
  }

  private static QuestionStatus statusOf(Attempt last) {
    if (last.correct()) {
      return QuestionStatus.PASS;
    }
    return last.hasError() ? QuestionStatus.ERROR : QuestionStatus.FAIL;
  }

  private static Trend trendOf(Attempt first, Attempt last, int size) {
    if (size < 2) {
      return Trend.STABLE;
    }
    if (!first.correct() && last.correct()) {
      return Trend.IMPROVING;
    }
    if (first.correct() && !last.correct()) {
      return Trend.REGRESSING;
    }
    return Trend.STABLE;
  }
}
