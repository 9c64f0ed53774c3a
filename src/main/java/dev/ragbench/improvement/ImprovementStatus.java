package dev.ragbench.improvement;

/**
 * Lifecycle of a backlog item: {@code PENDING -> APPLIED -> VERIFIED}, or {@code APPLIED ->
 * FAILED}.
 */
public enum ImprovementStatus {
  PENDING,
  APPLIED,
  VERIFIED,
  FAILED
}
