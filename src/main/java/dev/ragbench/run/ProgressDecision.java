package dev.ragbench.run;

/** Answer of a {@link RunProgressListener}: keep dispatching questions or stop the run. */
public enum ProgressDecision {
  CONTINUE,
  STOP
}
