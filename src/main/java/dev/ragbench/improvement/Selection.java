package dev.ragbench.improvement;

import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Result of {@link ImprovementSelector#selectNext}.
 *
 * @param improvement the chosen item, null unless {@code outcome} is SELECTED
 * @param outcome why the selection ended the way it did
 * @param reason human-readable explanation
 */
public record Selection(@Nullable Improvement improvement, Outcome outcome, String reason) {

  public enum Outcome {
    SELECTED,
    /** No pending item at all. */
    NO_PENDING,
    /** The forced pipeline has no pending item. */
    EXHAUSTED
  }

  public Selection {
    if ((improvement != null) != (outcome == Outcome.SELECTED)) {
      throw new IllegalArgumentException("improvement must be set exactly when SELECTED");
    }
  }

  static Selection selected(Improvement improvement, String reason) {
    return new Selection(improvement, Outcome.SELECTED, reason);
  }

  static Selection none(Outcome outcome, String reason) {
    return new Selection(null, outcome, reason);
  }

  public Optional<Improvement> selected() {
    return Optional.ofNullable(improvement);
  }
}
