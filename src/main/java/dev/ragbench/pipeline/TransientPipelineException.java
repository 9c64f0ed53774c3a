package dev.ragbench.pipeline;

import org.jspecify.annotations.Nullable;

/**
 * Signals a pipeline failure worth retrying: connection trouble, a timeout, a 5xx or a 403.
 *
 * <p>Only thrown inside {@link PipelineClient}'s retry callback; callers of the client never see
 * it.
 */
class TransientPipelineException extends RuntimeException {

  private final ErrorType errorType;
  private final @Nullable Integer httpStatus;

  TransientPipelineException(
      String message,
      ErrorType errorType,
      @Nullable Integer httpStatus,
      @Nullable Throwable cause) {
    super(message, cause);
    this.errorType = errorType;
    this.httpStatus = httpStatus;
  }

  ErrorType errorType() {
    return errorType;
  }

  @Nullable Integer httpStatus() {
    return httpStatus;
  }
}
