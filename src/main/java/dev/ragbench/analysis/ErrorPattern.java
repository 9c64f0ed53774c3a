package dev.ragbench.analysis;

import dev.ragbench.pipeline.ErrorType;
import java.util.List;
import java.util.Set;

/**
 * Errored attempts of the latest iteration sharing one error type.
 *
 * @param errorType shared error type, {@link ErrorType#UNKNOWN} for untyped errors
 * @param count number of errored attempts
 * @param severity {@link Severity#forOccurrences(int)} of {@code count}
 * @param pipelines pipelines affected
 * @param questionIds affected questions in attempt order
 * @param sampleErrors first few distinct error messages
 */
public record ErrorPattern(
    ErrorType errorType,
    int count,
    Severity severity,
    Set<String> pipelines,
    List<String> questionIds,
    List<String> sampleErrors) {

  public ErrorPattern {
    pipelines = Set.copyOf(pipelines);
    questionIds = List.copyOf(questionIds);
    sampleErrors = List.copyOf(sampleErrors);
  }
}
