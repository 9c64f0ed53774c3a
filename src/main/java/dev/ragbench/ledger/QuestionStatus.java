package dev.ragbench.ledger;

/** Outcome of a question's most recent run. */
public enum QuestionStatus {
  PASS,
  FAIL,
  ERROR
}
