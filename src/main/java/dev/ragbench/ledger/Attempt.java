package dev.ragbench.ledger;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.ragbench.matching.MatchMethod;
import dev.ragbench.pipeline.ErrorType;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * One question sent to one pipeline, with its outcome. Immutable once recorded.
 *
 * <p>The same record is stored in an {@link Iteration} and, as a run, in the question's {@link
 * QuestionRegistryEntry}. Snake-case names from older ledgers are accepted as aliases.
 *
 * @param questionId question id
 * @param pipeline pipeline that answered
 * @param iterationId iteration the attempt belongs to
 * @param producedAnswer extracted answer, possibly empty
 * @param correct matcher verdict
 * @param score token F1 in [0, 1]
 * @param matchMethod deciding matcher strategy
 * @param latencyMs end-to-end latency of the pipeline call
 * @param error error message when the attempt failed
 * @param errorType classification of {@code error}
 * @param timestamp when the attempt finished
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Attempt(
    @JsonAlias({"question_id", "id"}) @Nullable String questionId,
    @JsonAlias("rag_type") @Nullable String pipeline,
    @JsonAlias("iteration_id") @Nullable String iterationId,
    @JsonAlias({"answer", "produced_answer"}) @Nullable String producedAnswer,
    boolean correct,
    @JsonAlias("f1") double score,
    @JsonAlias("match_type") @Nullable MatchMethod matchMethod,
    @JsonAlias("latency_ms") long latencyMs,
    @Nullable String error,
    @JsonAlias("error_type") @Nullable ErrorType errorType,
    @Nullable Instant timestamp) {

  public Attempt {
    producedAnswer = producedAnswer == null ? "" : producedAnswer;
  }

  public boolean hasError() {
    return error != null && !error.isEmpty();
  }

  /** Error type for grouping: {@link ErrorType#UNKNOWN} when an errored attempt has none. */
  public @Nullable ErrorType effectiveErrorType() {
    if (!hasError()) {
      return null;
    }
    return errorType == null ? ErrorType.UNKNOWN : errorType;
  }

  /** Fills in identifiers that older ledgers left out of registry runs. */
  Attempt withDefaults(String defaultQuestionId, @Nullable String defaultPipeline) {
    if (questionId != null && pipeline != null) {
      return this;
    }
    return new Attempt(
        questionId == null ? defaultQuestionId : questionId,
        pipeline == null ? defaultPipeline : pipeline,
        iterationId,
        producedAnswer,
        correct,
        score,
        matchMethod,
        latencyMs,
        error,
        errorType,
        timestamp);
  }
}
