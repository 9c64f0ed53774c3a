package dev.ragbench.matching;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables for {@link AnswerMatcher}, bound from {@code ragbench.matching.*}.
 *
 * @param f1Threshold minimum token F1 accepted as a match, in [0.3, 0.5]
 * @param entityFraction fraction of expected entities that must be exceeded for an entity match
 * @param numericTolerance relative tolerance for numeric agreement
 * @param yearLowerBound smallest literal treated as a plausible year
 * @param yearUpperBound largest literal treated as a plausible year
 */
@ConfigurationProperties(prefix = "ragbench.matching")
public record MatchingProperties(
    @DefaultValue("0.5") double f1Threshold,
    @DefaultValue("0.5") double entityFraction,
    @DefaultValue("0.05") double numericTolerance,
    @DefaultValue("2019") int yearLowerBound,
    @DefaultValue("2030") int yearUpperBound) {

  public MatchingProperties {
    if (f1Threshold < 0.3 || f1Threshold > 0.5) {
      throw new IllegalStateException(
          "ragbench.matching.f1-threshold must be in [0.3, 0.5], got: " + f1Threshold);
    }
    if (entityFraction <= 0.0 || entityFraction >= 1.0) {
      throw new IllegalStateException(
          "ragbench.matching.entity-fraction must be in (0, 1), got: " + entityFraction);
    }
    if (numericTolerance < 0.0 || numericTolerance >= 1.0) {
      throw new IllegalStateException(
          "ragbench.matching.numeric-tolerance must be in [0, 1), got: " + numericTolerance);
    }
  }

  public static MatchingProperties defaults() {
    return new MatchingProperties(0.5, 0.5, 0.05, 2019, 2030);
  }
}
