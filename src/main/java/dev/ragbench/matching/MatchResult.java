package dev.ragbench.matching;

/**
 * Verdict of {@link AnswerMatcher#evaluate(String, String)}.
 *
 * @param correct whether the produced answer is accepted
 * @param score token-overlap F1 in [0, 1], reported regardless of the method that fired
 * @param method the strategy that decided the verdict
 */
public record MatchResult(boolean correct, double score, MatchMethod method) {

  public MatchResult {
    if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
      throw new IllegalArgumentException("score must be in [0, 1] but was " + score);
    }
  }

  /** Result used for blank answers and for matcher faults. */
  public static MatchResult noAnswer() {
    return new MatchResult(false, 0.0, MatchMethod.NO_ANSWER);
  }
}
