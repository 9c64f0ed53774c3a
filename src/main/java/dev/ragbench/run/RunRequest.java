package dev.ragbench.run;

import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.ledger.RunState;
import dev.ragbench.question.Question;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Input of one coordinated run.
 *
 * @param questionsByPipeline questions per pipeline, in submission order
 * @param runState ids to skip; {@link RunState#empty()} ignores earlier progress
 * @param label iteration label
 * @param baseline ledger the run appends to
 */
public record RunRequest(
    Map<String, List<Question>> questionsByPipeline,
    RunState runState,
    @Nullable String label,
    LedgerSnapshot baseline) {

  public RunRequest {
    Map<String, List<Question>> copy = new LinkedHashMap<>();
    questionsByPipeline.forEach(
        (pipeline, questions) -> copy.put(pipeline, List.copyOf(questions)));
    questionsByPipeline = Collections.unmodifiableMap(copy);
  }
}
