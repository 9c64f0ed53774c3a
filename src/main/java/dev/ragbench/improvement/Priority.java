package dev.ragbench.improvement;

/** Backlog priority tier, P0 being the most urgent. */
public enum Priority {
  P0,
  P1,
  P2,
  P3
}
