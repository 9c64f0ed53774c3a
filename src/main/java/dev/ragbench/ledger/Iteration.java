package dev.ragbench.ledger;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * One evaluation run's batch of attempts.
 *
 * <p>The summary is derived from the attempts whenever attempts are present; a stored summary is
 * only kept for legacy iterations whose attempt list was not preserved. An iteration without
 * {@code endedAt} was flushed by a checkpoint of a run that never finished and remains part of
 * the history.
 *
 * @param id unique iteration id
 * @param sequenceNumber position in the ledger, starting at 1
 * @param startedAt run start
 * @param endedAt run end, null while running or after a crash
 * @param label free-form label
 * @param attempts attempts in recording order
 * @param resultsSummary per-pipeline summary
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Iteration(
    String id,
    @JsonAlias("number") int sequenceNumber,
    @JsonAlias("timestamp_start") @Nullable Instant startedAt,
    @JsonAlias("timestamp_end") @Nullable Instant endedAt,
    @Nullable String label,
    @JsonAlias("questions") List<Attempt> attempts,
    @JsonAlias("results_summary") Map<String, PipelineSummary> resultsSummary) {

  public Iteration {
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
    if (attempts.isEmpty() && resultsSummary != null) {
      resultsSummary = Collections.unmodifiableMap(new LinkedHashMap<>(resultsSummary));
    } else {
      resultsSummary = Collections.unmodifiableMap(IterationSummaries.summarize(attempts));
    }
  }

  @JsonIgnore
  public boolean isComplete() {
    return endedAt != null;
  }

  /** Whether the iteration carries any result, from its attempts or a legacy summary. */
  @JsonIgnore
  public boolean hasResults() {
    return !resultsSummary.isEmpty();
  }

  public Optional<PipelineSummary> summaryFor(String pipeline) {
    return Optional.ofNullable(resultsSummary.get(pipeline));
  }

  Iteration withEndedAt(Instant endedAt) {
    return new Iteration(id, sequenceNumber, startedAt, endedAt, label, attempts, resultsSummary);
  }
}
