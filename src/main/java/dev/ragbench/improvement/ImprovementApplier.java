package dev.ragbench.improvement;

/** Carries out a backlog item outside this process, e.g. by patching and redeploying. */
@FunctionalInterface
public interface ImprovementApplier {

  /** Applies {@code improvement}; implementations report failures in the result. */
  ApplyResult apply(Improvement improvement);

  /**
   * What the applier reported.
   *
   * @param success whether the change is in place
   * @param message output or failure description
   */
  record ApplyResult(boolean success, String message) {

    public static ApplyResult success(String message) {
      return new ApplyResult(true, message);
    }

    public static ApplyResult failure(String message) {
      return new ApplyResult(false, message);
    }
  }
}
