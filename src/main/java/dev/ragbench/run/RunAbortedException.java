package dev.ragbench.run;

/**
 * Raised when a pipeline worker dies from an unexpected error.
 *
 * <p>The remaining workers are cancelled and the attempts recorded so far are saved before this
 * is thrown.
 */
public class RunAbortedException extends RuntimeException {

  public RunAbortedException(String message, Throwable cause) {
    super(message, cause);
  }
}
