package dev.ragbench.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Turns analysis findings into suggestions.
 *
 * <ul>
 *   <li>any regression: HIGH, pointing at the pipeline with the most regressions
 *   <li>an error type seen at least three times: HIGH from five occurrences, else MEDIUM
 *   <li>a gap above {@code gapSuggestionPp}: HIGH above {@code highGapPp}, else MEDIUM
 *   <li>at least {@code flakySuggestionMin} flaky questions: MEDIUM
 * </ul>
 */
@Component
public class SuggestionGenerator {

  private static final int MIN_PATTERN_OCCURRENCES = 3;
  private static final int FLAKY_IDS_SHOWN = 5;

  private final AnalysisProperties properties;

  public SuggestionGenerator(AnalysisProperties properties) {
    this.properties = properties;
  }

  /** Returns suggestions ordered by severity, in generation order within a severity. */
  public List<Suggestion> generate(
      RegressionReport regressions,
      List<ErrorPattern> errorPatterns,
      List<FlakyQuestion> flaky,
      List<PipelineGap> gaps) {
    List<Suggestion> suggestions = new ArrayList<>();

    if (!regressions.regressions().isEmpty()) {
      Map<String, Integer> perPipeline = new LinkedHashMap<>();
      for (QuestionChange change : regressions.regressions()) {
        String pipeline = change.pipeline() == null ? "unknown" : change.pipeline();
        perPipeline.merge(pipeline, 1, Integer::sum);
      }
      String worst =
          perPipeline.entrySet().stream()
              .max(Map.Entry.comparingByValue())
              .map(Map.Entry::getKey)
              .orElse("unknown");
      int count = regressions.regressions().size();
      suggestions.add(
          new Suggestion(
              Severity.HIGH,
              worst,
              "Investigate "
                  + count
                  + " regressions (most in "
                  + worst
                  + "). Revert recent changes if the regression is widespread.",
              count
                  + " questions regressed between "
                  + regressions.previousIteration()
                  + " and "
                  + regressions.currentIteration()));
    }

    for (ErrorPattern pattern : errorPatterns) {
      if (pattern.count() < MIN_PATTERN_OCCURRENCES) {
        continue;
      }
      String pipelines = pattern.pipelines().stream().sorted().collect(Collectors.joining(", "));
      suggestions.add(
          new Suggestion(
              pattern.count() >= 5 ? Severity.HIGH : Severity.MEDIUM,
              pipelines,
              "Fix "
                  + pattern.errorType()
                  + " errors ("
                  + pattern.count()
                  + " occurrences). Concentrated in: "
                  + pipelines,
              pattern.errorType() + ": " + pattern.count() + " errors"));
    }

    for (PipelineGap gap : gaps) {
      if (gap.onTarget() || gap.gapPp() <= properties.gapSuggestionPp()) {
        continue;
      }
      String direction =
          gap.plateaued()
              ? "Accuracy has plateaued, try a different approach."
              : "Continue the current improvement path.";
      suggestions.add(
          new Suggestion(
              gap.gapPp() > properties.highGapPp() ? Severity.HIGH : Severity.MEDIUM,
              gap.pipeline(),
              String.format(
                  Locale.ROOT,
                  "%s is %.1fpp below target (%.1f%% vs %.1f%%). %s",
                  gap.pipeline(),
                  gap.gapPp(),
                  gap.currentAccuracyPct(),
                  gap.targetAccuracyPct(),
                  direction),
              String.format(
                  Locale.ROOT,
                  "Gap: %.1fpp, error rate: %.1f%%",
                  gap.gapPp(),
                  gap.errorRatePct())));
    }

    if (flaky.size() >= properties.flakySuggestionMin()) {
      String ids =
          flaky.stream()
              .limit(FLAKY_IDS_SHOWN)
              .map(FlakyQuestion::questionId)
              .collect(Collectors.joining(", "));
      suggestions.add(
          new Suggestion(
              Severity.MEDIUM,
              "stability",
              flaky.size()
                  + " flaky questions detected. Investigate non-determinism in the pipelines.",
              "Flaky ids: " + ids));
    }

    suggestions.sort(Comparator.comparing(Suggestion::severity));
    return suggestions;
  }
}
