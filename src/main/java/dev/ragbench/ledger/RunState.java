package dev.ragbench.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Ids already tested per pipeline; a resumed run skips them.
 *
 * <p>Passed into the run coordinator, returned by it and persisted in the ledger. Immutable.
 *
 * @param testedIds tested question ids per pipeline
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RunState(Map<String, Set<String>> testedIds) {

  private static final RunState EMPTY = new RunState(Map.of());

  public RunState {
    Map<String, Set<String>> copy = new TreeMap<>();
    if (testedIds != null) {
      testedIds.forEach(
          (pipeline, ids) ->
              copy.put(pipeline, Collections.unmodifiableSet(new TreeSet<>(ids))));
    }
    testedIds = Collections.unmodifiableMap(copy);
  }

  public static RunState empty() {
    return EMPTY;
  }

  /** Derives the tested ids from registry entries, one id per entry under its pipeline. */
  public static RunState fromRegistry(Collection<QuestionRegistryEntry> entries) {
    Map<String, Set<String>> tested = new TreeMap<>();
    for (QuestionRegistryEntry entry : entries) {
      String pipeline = entry.pipeline() == null ? "unknown" : entry.pipeline();
      tested.computeIfAbsent(pipeline, k -> new TreeSet<>()).add(entry.questionId());
    }
    return new RunState(tested);
  }

  public boolean isTested(String pipeline, String questionId) {
    return testedIds.getOrDefault(pipeline, Set.of()).contains(questionId);
  }

  public Set<String> testedFor(String pipeline) {
    return testedIds.getOrDefault(pipeline, Set.of());
  }

  public int totalTested() {
    return testedIds.values().stream().mapToInt(Set::size).sum();
  }

  /** Returns a state that also contains {@code ids} under {@code pipeline}. */
  public RunState withTested(String pipeline, Collection<String> ids) {
    Map<String, Set<String>> merged = new TreeMap<>(testedIds);
    Set<String> union = new TreeSet<>(testedFor(pipeline));
    union.addAll(ids);
    merged.put(pipeline, union);
    return new RunState(merged);
  }

  /** Returns a state without {@code ids} under {@code pipeline}, so a run tests them again. */
  public RunState without(String pipeline, Collection<String> ids) {
    if (!testedIds.containsKey(pipeline)) {
      return this;
    }
    Map<String, Set<String>> reduced = new TreeMap<>(testedIds);
    Set<String> remaining = new TreeSet<>(testedFor(pipeline));
    remaining.removeAll(ids);
    reduced.put(pipeline, remaining);
    return new RunState(reduced);
  }
}
