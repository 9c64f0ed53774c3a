package dev.ragbench.run;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Stages executed by a staged run, in order; later stages only hold pipelines that advanced. */
public record StagedRunOutcome(List<StageResult> stages) {

  public StagedRunOutcome {
    stages = List.copyOf(stages);
  }

  /** Last verdict of every pipeline that took part in at least one stage. */
  public Map<String, StageVerdict> finalVerdicts() {
    Map<String, StageVerdict> last = new LinkedHashMap<>();
    for (StageResult stage : stages) {
      last.putAll(stage.verdicts());
    }
    return last;
  }

  public boolean cancelled() {
    return !stages.isEmpty() && stages.get(stages.size() - 1).outcome().cancelled();
  }
}
