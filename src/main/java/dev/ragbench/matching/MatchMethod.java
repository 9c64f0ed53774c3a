package dev.ragbench.matching;

/** Strategy that decided an answer's verdict, in the order {@link AnswerMatcher} tries them. */
public enum MatchMethod {
  /** The produced answer was blank. */
  NO_ANSWER,
  /** Enough comma-separated expected entities were found in the answer. */
  ENTITY_MATCH,
  /** Token-overlap F1 reached the configured threshold. */
  F1_MATCH,
  /** Primary numbers of both strings agree within the relative tolerance. */
  NUMERIC_MATCH,
  /** The normalized expected answer occurs inside the normalized produced answer. */
  SUBSTRING_MATCH,
  /** No strategy accepted the answer; the score still carries the F1 value. */
  PARTIAL
}
