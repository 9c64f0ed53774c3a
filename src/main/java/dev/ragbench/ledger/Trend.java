package dev.ragbench.ledger;

/** Direction of a question's history, from its first run to its last. */
public enum Trend {
  IMPROVING,
  REGRESSING,
  STABLE
}
