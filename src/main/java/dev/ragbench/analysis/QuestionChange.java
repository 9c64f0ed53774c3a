package dev.ragbench.analysis;

import dev.ragbench.pipeline.ErrorType;
import org.jspecify.annotations.Nullable;

/**
 * A question whose verdict flipped between the two latest iterations.
 *
 * @param questionId question id
 * @param pipeline pipeline that answered
 * @param previousScore F1 in the earlier iteration
 * @param currentScore F1 in the latest iteration
 * @param error error of the latest attempt, if any
 * @param errorType error type of the latest attempt, if any
 * @param previousAnswer earlier answer, shortened
 * @param currentAnswer latest answer, shortened
 */
public record QuestionChange(
    String questionId,
    @Nullable String pipeline,
    double previousScore,
    double currentScore,
    @Nullable String error,
    @Nullable ErrorType errorType,
    String previousAnswer,
    String currentAnswer) {}
