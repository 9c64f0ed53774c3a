package dev.ragbench.improvement;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * The improvement backlog, an immutable value.
 *
 * <p>Transitions return a new backlog with the item replaced in place; list order is preserved.
 *
 * @param revision optimistic-versioning counter, increased on every save
 * @param improvements items in document order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Backlog(long revision, List<Improvement> improvements) {

  public Backlog {
    improvements = improvements == null ? List.of() : List.copyOf(improvements);
    Set<String> ids = new HashSet<>();
    for (Improvement improvement : improvements) {
      if (!ids.add(improvement.id())) {
        throw new IllegalArgumentException("Duplicate improvement id: " + improvement.id());
      }
    }
  }

  public static Backlog empty() {
    return new Backlog(0, List.of());
  }

  public Optional<Improvement> find(String id) {
    return improvements.stream().filter(i -> i.id().equals(id)).findFirst();
  }

  @JsonIgnore
  public List<Improvement> pending() {
    return improvements.stream().filter(i -> i.status() == ImprovementStatus.PENDING).toList();
  }

  /**
   * Moves a pending item to APPLIED.
   *
   * @throws IllegalArgumentException if no item has {@code id}
   * @throws IllegalStateException if the item is not PENDING
   */
  public Backlog markApplied(String id, Instant at, @Nullable Double baselineAccuracyPct) {
    return transition(id, ImprovementStatus.PENDING, i -> i.applied(at, baselineAccuracyPct));
  }

  /**
   * Moves an applied item to VERIFIED.
   *
   * @throws IllegalArgumentException if no item has {@code id}
   * @throws IllegalStateException if the item is not APPLIED
   */
  public Backlog markVerified(String id, Instant at, double actualImpactPp) {
    return transition(id, ImprovementStatus.APPLIED, i -> i.verified(at, actualImpactPp));
  }

  /**
   * Moves an applied item to FAILED. Failed items are never selected again.
   *
   * @throws IllegalArgumentException if no item has {@code id}
   * @throws IllegalStateException if the item is not APPLIED
   */
  public Backlog markFailed(
      String id, Instant at, @Nullable Double actualImpactPp, String reason) {
    return transition(id, ImprovementStatus.APPLIED, i -> i.failed(at, actualImpactPp, reason));
  }

  Backlog withRevision(long newRevision) {
    return new Backlog(newRevision, improvements);
  }

  private Backlog transition(
      String id, ImprovementStatus required, UnaryOperator<Improvement> change) {
    List<Improvement> updated = new ArrayList<>(improvements);
    for (int i = 0; i < updated.size(); i++) {
      Improvement current = updated.get(i);
      if (!current.id().equals(id)) {
        continue;
      }
      if (current.status() != required) {
        throw new IllegalStateException(
            "Improvement " + id + " is " + current.status() + ", expected " + required);
      }
      updated.set(i, change.apply(current));
      return new Backlog(revision, updated);
    }
    throw new IllegalArgumentException("Unknown improvement: " + id);
  }
}
