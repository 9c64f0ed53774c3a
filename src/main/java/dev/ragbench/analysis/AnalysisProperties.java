package dev.ragbench.analysis;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Analysis thresholds, bound from {@code ragbench.analysis.*}.
 *
 * @param plateauThresholdPp a change smaller than this between the two latest accuracy points is a
 *     plateau
 * @param gapSuggestionPp gaps above this produce a suggestion
 * @param highGapPp gaps above this make the suggestion HIGH
 * @param flakySuggestionMin number of flaky questions that produces a suggestion
 */
@ConfigurationProperties(prefix = "ragbench.analysis")
public record AnalysisProperties(
    @DefaultValue("1.0") double plateauThresholdPp,
    @DefaultValue("10.0") double gapSuggestionPp,
    @DefaultValue("20.0") double highGapPp,
    @DefaultValue("3") int flakySuggestionMin) {

  public AnalysisProperties {
    if (plateauThresholdPp < 0.0) {
      throw new IllegalStateException(
          "ragbench.analysis.plateau-threshold-pp must be >= 0, got: " + plateauThresholdPp);
    }
  }

  public static AnalysisProperties defaults() {
    return new AnalysisProperties(1.0, 10.0, 20.0, 3);
  }
}
