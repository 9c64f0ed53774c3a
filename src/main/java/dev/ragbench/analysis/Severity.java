package dev.ragbench.analysis;

/** Priority of an analysis finding, most urgent first. */
public enum Severity {
  HIGH,
  MEDIUM,
  LOW;

  /** Error-pattern priority: five or more occurrences is HIGH, three or more MEDIUM. */
  public static Severity forOccurrences(int count) {
    if (count >= 5) {
      return HIGH;
    }
    return count >= 3 ? MEDIUM : LOW;
  }
}
