package dev.ragbench.analysis;

import dev.ragbench.ledger.Attempt;
import dev.ragbench.ledger.Iteration;
import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.pipeline.ErrorType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Buckets the errored attempts of the latest iteration by error type. */
@Component
public class ErrorPatternAnalyzer {

  private static final int MAX_SAMPLES = 3;
  private static final int SAMPLE_LENGTH = 100;

  /**
   * Groups errors of the latest iteration.
   *
   * @return one pattern per error type, most frequent first; empty without iterations
   */
  public List<ErrorPattern> analyze(LedgerSnapshot snapshot) {
    Optional<Iteration> latest = snapshot.latestIteration();
    if (latest.isEmpty()) {
      return List.of();
    }
    Map<ErrorType, List<Attempt>> byType = new EnumMap<>(ErrorType.class);
    for (Attempt attempt : latest.get().attempts()) {
      ErrorType type = attempt.effectiveErrorType();
      if (type != null) {
        byType.computeIfAbsent(type, k -> new ArrayList<>()).add(attempt);
      }
    }

    List<ErrorPattern> patterns = new ArrayList<>(byType.size());
    byType.forEach((type, attempts) -> patterns.add(toPattern(type, attempts)));
    patterns.sort(
        Comparator.comparingInt(ErrorPattern::count)
            .reversed()
            .thenComparing(ErrorPattern::errorType));
    return patterns;
  }

  private static ErrorPattern toPattern(ErrorType type, List<Attempt> attempts) {
    Set<String> pipelines = new LinkedHashSet<>();
    List<String> questionIds = new ArrayList<>(attempts.size());
    Set<String> samples = new LinkedHashSet<>();
    for (Attempt attempt : attempts) {
      if (attempt.pipeline() != null) {
        pipelines.add(attempt.pipeline());
      }
      if (attempt.questionId() != null) {
        questionIds.add(attempt.questionId());
      }
      if (samples.size() < MAX_SAMPLES && attempt.error() != null) {
        String error = attempt.error();
        samples.add(error.length() > SAMPLE_LENGTH ? error.substring(0, SAMPLE_LENGTH) : error);
      }
    }
    return new ErrorPattern(
        type,
        attempts.size(),
        Severity.forOccurrences(attempts.size()),
        pipelines,
        questionIds,
        new ArrayList<>(samples));
  }
}
