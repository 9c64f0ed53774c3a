package dev.ragbench.run;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One executed stage of a staged run.
 *
 * @param number 1-based stage number
 * @param name stage display name
 * @param outcome the stage's coordinated run
 * @param verdicts per-pipeline advancement verdicts
 */
public record StageResult(
    int number, String name, RunOutcome outcome, Map<String, StageVerdict> verdicts) {

  public StageResult {
    verdicts = Collections.unmodifiableMap(new LinkedHashMap<>(verdicts));
  }
}
