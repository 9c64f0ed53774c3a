package dev.ragbench.config;

/**
 * Raised when an evaluation cannot start because its inputs are inconsistent: an unknown
 * pipeline, an empty or unreadable dataset, duplicate question ids, or an invalid phase
 * definition.
 *
 * <p>Always raised before any pipeline is called.
 */
public class EvaluationConfigurationException extends RuntimeException {

  public EvaluationConfigurationException(String message) {
    super(message);
  }

  public EvaluationConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
