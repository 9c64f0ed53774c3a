package dev.ragbench.matching;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Judges a produced answer against an expected one with approximate-matching strategies.
 *
 * <p>Strategies run in a fixed order and the first that accepts wins: entity subset, F1
 * threshold, numeric tolerance, substring. Token F1 is always computed and reported as the score.
 * Callers flatten structured responses to plain text before calling; {@link #evaluate} is pure and
 * thread-safe.
 */
@Component
public class AnswerMatcher {

  private static final int MIN_SIGNIFICANT_TOKEN_LENGTH = 3;

  private final MatchingProperties properties;
  private final NumberExtractor numberExtractor;

  public AnswerMatcher(MatchingProperties properties) {
    this.properties = properties;
    this.numberExtractor =
        new NumberExtractor(properties.yearLowerBound(), properties.yearUpperBound());
  }

  /**
   * Evaluates one answer.
   *
   * @param produced the pipeline's answer text, possibly blank
   * @param expected the reference answer
   * @return verdict with F1 score and the deciding method
   */
  public MatchResult evaluate(String produced, String expected) {
    if (produced == null || produced.isBlank()) {
      return MatchResult.noAnswer();
    }
    String safeExpected = expected == null ? "" : expected;
    double f1 = TextNormalizer.f1(produced, safeExpected);
    Set<String> producedTokens = TextNormalizer.tokens(produced);

    if (entitiesMatch(producedTokens, safeExpected)) {
      return new MatchResult(true, f1, MatchMethod.ENTITY_MATCH);
    }
    if (f1 >= properties.f1Threshold()) {
      return new MatchResult(true, f1, MatchMethod.F1_MATCH);
    }
    if (numbersMatch(produced, safeExpected)) {
      return new MatchResult(true, f1, MatchMethod.NUMERIC_MATCH);
    }
    String normalizedExpected = TextNormalizer.normalize(safeExpected);
    if (!normalizedExpected.isEmpty()
        && TextNormalizer.normalize(produced).contains(normalizedExpected)) {
      return new MatchResult(true, f1, MatchMethod.SUBSTRING_MATCH);
    }
    return new MatchResult(false, f1, MatchMethod.PARTIAL);
  }

  /**
   * An expected entity is found when all of its significant tokens (longer than two characters
   * and containing a letter) are among the produced tokens. Entities without significant tokens
   * are not counted.
   */
  private boolean entitiesMatch(Set<String> producedTokens, String expected) {
    List<Set<String>> entities =
        Stream.of(expected.split(","))
            .map(AnswerMatcher::significantTokens)
            .filter(tokens -> !tokens.isEmpty())
            .toList();
    if (entities.isEmpty()) {
      return false;
    }
    long found = entities.stream().filter(producedTokens::containsAll).count();
    return (double) found / entities.size() > properties.entityFraction();
  }

  private static Set<String> significantTokens(String entity) {
    return TextNormalizer.tokens(entity).stream()
        .filter(token -> token.length() >= MIN_SIGNIFICANT_TOKEN_LENGTH)
        .filter(token -> token.chars().anyMatch(Character::isLetter))
        .collect(Collectors.toSet());
  }

  private boolean numbersMatch(String produced, String expected) {
    OptionalDouble expectedNumber = numberExtractor.primary(expected);
    if (expectedNumber.isEmpty()) {
      return false;
    }
    OptionalDouble producedNumber = numberExtractor.primary(produced);
    if (producedNumber.isEmpty()) {
      return false;
    }
    double want = expectedNumber.getAsDouble();
    double got = producedNumber.getAsDouble();
    if (want == 0.0) {
      return got == 0.0;
    }
    return Math.abs(got - want) / Math.abs(want) <= properties.numericTolerance();
  }
}
