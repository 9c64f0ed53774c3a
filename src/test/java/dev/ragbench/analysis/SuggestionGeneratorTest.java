package dev.ragbench.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import dev.ragbench.pipeline.ErrorType;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SuggestionGeneratorTest {

  private final SuggestionGenerator generator =
      new SuggestionGenerator(AnalysisProperties.defaults());

  @Test
  void nothingToReportProducesNoSuggestion() {
    assertThat(generator.generate(RegressionReport.noData(), List.of(), List.of(), List.of()))
        .isEmpty();
  }

  @Test
  void regressionsPointAtThePipelineWithTheMost() {
    RegressionReport regressions =
        new RegressionReport(
            true,
            "baseline",
            "after-prompt-change",
            10,
            List.of(change("q1", "graph"), change("q2", "graph"), change("q3", "standard")),
            List.of());

    List<Suggestion> suggestions = generator.generate(regressions, List.of(), List.of(), List.of());

    assertThat(suggestions).hasSize(1);
    Suggestion suggestion = suggestions.get(0);
    assertThat(suggestion.severity()).isEqualTo(Severity.HIGH);
    assertThat(suggestion.area()).isEqualTo("graph");
    assertThat(suggestion.evidence())
        .isEqualTo("3 questions regressed between baseline and after-prompt-change");
  }

  @Test
  void errorPatternsNeedThreeOccurrences() {
    List<Suggestion> suggestions =
        generator.generate(
            RegressionReport.noData(),
            List.of(
                pattern(ErrorType.TIMEOUT, 5, "orchestrator", "graph"),
                pattern(ErrorType.RATE_LIMIT, 3, "standard"),
                pattern(ErrorType.NETWORK, 2, "graph")),
            List.of(),
            List.of());

    assertThat(suggestions)
        .extracting(Suggestion::severity, Suggestion::area)
        .containsExactly(
            tuple(Severity.HIGH, "graph, orchestrator"),
            tuple(Severity.MEDIUM, "standard"));
  }

  @Test
  void gapSeverityDependsOnSizeAndPlateauChangesTheAdvice() {
    List<Suggestion> suggestions =
        generator.generate(
            RegressionReport.noData(),
            List.of(),
            List.of(),
            List.of(
                gap("graph", 45.0, 70.0, true),
                gap("quantitative", 72.0, 85.0, false),
                gap("standard", 80.0, 85.0, false)));

    assertThat(suggestions).extracting(Suggestion::area).containsExactly("graph", "quantitative");
    assertThat(suggestions.get(0).severity()).isEqualTo(Severity.HIGH);
    assertThat(suggestions.get(0).text())
        .isEqualTo(
            "graph is 25.0pp below target (45.0% vs 70.0%). "
                + "Accuracy has plateaued, try a different approach.");
    assertThat(suggestions.get(1).severity()).isEqualTo(Severity.MEDIUM);
    assertThat(suggestions.get(1).text()).endsWith("Continue the current improvement path.");
  }

  @Test
  void flakyQuestionsAboveMinimumProduceAStabilitySuggestion() {
    List<FlakyQuestion> flaky =
        List.of(flaky("q1"), flaky("q2"), flaky("q3"), flaky("q4"), flaky("q5"), flaky("q6"));

    List<Suggestion> suggestions =
        generator.generate(RegressionReport.noData(), List.of(), flaky, List.of());

    assertThat(suggestions).hasSize(1);
    Suggestion suggestion = suggestions.get(0);
    assertThat(suggestion.area()).isEqualTo("stability");
    assertThat(suggestion.severity()).isEqualTo(Severity.MEDIUM);
    assertThat(suggestion.evidence()).isEqualTo("Flaky ids: q1, q2, q3, q4, q5");
    assertThat(
            generator.generate(
                RegressionReport.noData(), List.of(), flaky.subList(0, 2), List.of()))
        .isEmpty();
  }

  @Test
  void suggestionsAreOrderedBySeverity() {
    List<Suggestion> suggestions =
        generator.generate(
            RegressionReport.noData(),
            List.of(pattern(ErrorType.TIMEOUT, 3, "graph")),
            List.of(),
            List.of(gap("standard", 40.0, 85.0, false)));

    assertThat(suggestions)
        .extracting(Suggestion::severity)
        .containsExactly(Severity.HIGH, Severity.MEDIUM);
  }

  private static QuestionChange change(String questionId, String pipeline) {
    return new QuestionChange(questionId, pipeline, 1.0, 0.0, null, null, "before", "after");
  }

  private static ErrorPattern pattern(ErrorType type, int count, String... pipelines) {
    return new ErrorPattern(
        type, count, Severity.forOccurrences(count), Set.of(pipelines), List.of(), List.of());
  }

  private static PipelineGap gap(
      String pipeline, double current, double target, boolean plateaued) {
    double gap = target - current;
    return new PipelineGap(pipeline, current, target, gap, gap <= 0, plateaued, 20, 0, 0.0);
  }

  private static FlakyQuestion flaky(String questionId) {
    return new FlakyQuestion(questionId, "graph", "Question " + questionId, 0.5, 4, 2);
  }
}
