package dev.ragbench.ledger;

import dev.ragbench.question.Question;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, mutable registry of question histories used while a run is in progress.
 *
 * <p>Each update is an atomic {@code compute()} on the question's id that replaces its immutable
 * {@link QuestionRegistryEntry}; updates to different ids do not contend.
 */
public class QuestionRegistry {

  private final ConcurrentHashMap<String, QuestionRegistryEntry> entries =
      new ConcurrentHashMap<>();

  public QuestionRegistry() {}

  public QuestionRegistry(Map<String, QuestionRegistryEntry> initial) {
    entries.putAll(initial);
  }

  /**
   * Appends {@code attempt} to the question's history, creating the entry on first sight.
   *
   * @return the updated entry
   */
  public QuestionRegistryEntry record(Question question, Attempt attempt) {
    return entries.compute(
        question.id(),
        (id, existing) ->
            existing == null
                ? QuestionRegistryEntry.first(
                    id,
                    question.targetPipeline(),
                    question.text(),
                    question.expectedAnswer(),
                    attempt)
                : existing.withRun(attempt));
  }

  public Optional<QuestionRegistryEntry> get(String questionId) {
    return Optional.ofNullable(entries.get(questionId));
  }

  public int size() {
    return entries.size();
  }

  /** Returns an immutable copy ordered by question id. */
  public Map<String, QuestionRegistryEntry> snapshot() {
    return Collections.unmodifiableMap(new TreeMap<>(entries));
  }
}
