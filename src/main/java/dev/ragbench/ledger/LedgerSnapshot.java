package dev.ragbench.ledger;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * Immutable view of the ledger, and its persisted form.
 *
 * <p>Analyzers, the phase gate and the improvement selector read from a snapshot and never keep
 * their own copies. {@code revision} increases by one on every save.
 *
 * @param schemaVersion persisted schema version
 * @param revision optimistic-versioning counter
 * @param iterations iterations ordered by sequence number
 * @param questionRegistry registry entries keyed by question id
 * @param runState tested ids per pipeline
 * @param updatedAt time of the last save
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerSnapshot(
    int schemaVersion,
    long revision,
    List<Iteration> iterations,
    @JsonAlias("question_registry") Map<String, QuestionRegistryEntry> questionRegistry,
    @JsonAlias("run_state") @Nullable RunState runState,
    @Nullable Instant updatedAt) {

  public static final int CURRENT_SCHEMA_VERSION = 2;

  public LedgerSnapshot {
    List<Iteration> ordered = iterations == null ? new ArrayList<>() : new ArrayList<>(iterations);
    ordered.sort((a, b) -> Integer.compare(a.sequenceNumber(), b.sequenceNumber()));
    iterations = List.copyOf(ordered);
    questionRegistry =
        questionRegistry == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(questionRegistry));
  }

  public static LedgerSnapshot empty() {
    return new LedgerSnapshot(
        CURRENT_SCHEMA_VERSION, 0, List.of(), Map.of(), RunState.empty(), null);
  }

  /** Run state, never null: derived from the registry when the document carried none. */
  @JsonIgnore
  public RunState effectiveRunState() {
    return runState == null ? RunState.fromRegistry(questionRegistry.values()) : runState;
  }

  /** Iterations that recorded at least one result, oldest first. */
  @JsonIgnore
  public List<Iteration> evaluatedIterations() {
    return iterations.stream().filter(Iteration::hasResults).toList();
  }

  /** Most recent iteration that recorded results; empty iterations are skipped. */
  @JsonIgnore
  public Optional<Iteration> latestIteration() {
    for (int i = iterations.size() - 1; i >= 0; i--) {
      if (iterations.get(i).hasResults()) {
        return Optional.of(iterations.get(i));
      }
    }
    return Optional.empty();
  }

  /** Sequence number for the next iteration. */
  @JsonIgnore
  public int nextSequenceNumber() {
    return iterations.isEmpty() ? 1 : iterations.get(iterations.size() - 1).sequenceNumber() + 1;
  }

  /** Registry entries of one pipeline, ordered by question id. */
  public List<QuestionRegistryEntry> entriesFor(String pipeline) {
    return questionRegistry.values().stream()
        .filter(entry -> pipeline.equals(entry.pipeline()))
        .toList();
  }

  /** Pipelines seen in the registry or in any iteration summary, in first-seen order. */
  @JsonIgnore
  public List<String> knownPipelines() {
    LinkedHashSet<String> names = new LinkedHashSet<>();
    for (Iteration iteration : iterations) {
      names.addAll(iteration.resultsSummary().keySet());
    }
    for (QuestionRegistryEntry entry : questionRegistry.values()) {
      if (entry.pipeline() != null) {
        names.add(entry.pipeline());
      }
    }
    return List.copyOf(names);
  }

  /**
   * Accuracy of a pipeline over each question's most recent run.
   *
   * @return percent, or empty when the pipeline has no registry entries
   */
  public OptionalDouble currentAccuracyPct(String pipeline) {
    List<QuestionRegistryEntry> entries = entriesFor(pipeline);
    if (entries.isEmpty()) {
      return OptionalDouble.empty();
    }
    long passing = entries.stream().filter(entry -> entry.latestRun().correct()).count();
    return OptionalDouble.of(passing * 100.0 / entries.size());
  }

  /** Accuracy of the pipeline in every iteration that tested it, oldest first. */
  public List<Double> accuracySeries(String pipeline) {
    List<Double> series = new ArrayList<>();
    for (Iteration iteration : iterations) {
      iteration.summaryFor(pipeline).ifPresent(summary -> series.add(summary.accuracyPct()));
    }
    return series;
  }

  /** Latest iteration that tested {@code pipeline}, with its summary. */
  public Optional<PipelineSummary> latestSummaryFor(String pipeline) {
    for (int i = iterations.size() - 1; i >= 0; i--) {
      Optional<PipelineSummary> summary = iterations.get(i).summaryFor(pipeline);
      if (summary.isPresent()) {
        return summary;
      }
    }
    return Optional.empty();
  }

  LedgerSnapshot withRevision(long newRevision, Instant savedAt) {
    return new LedgerSnapshot(
        CURRENT_SCHEMA_VERSION,
        newRevision,
        iterations,
        questionRegistry,
        effectiveRunState(),
        savedAt);
  }
}
