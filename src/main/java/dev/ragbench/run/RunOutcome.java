package dev.ragbench.run;

import dev.ragbench.ledger.Iteration;
import dev.ragbench.ledger.LedgerSnapshot;
import dev.ragbench.ledger.RunState;
import java.util.Map;

/**
 * Result of one coordinated run.
 *
 * @param iteration the finished iteration with its summary; left out of the history when it has
 *     no attempts
 * @param runState tested ids after the run
 * @param progress final progress per pipeline
 * @param cancelled true when the run stopped before every question was dispatched
 * @param checkpoints number of durable flushes, the final one included
 * @param ledger the ledger as last saved
 */
public record RunOutcome(
    Iteration iteration,
    RunState runState,
    Map<String, PipelineProgress> progress,
    boolean cancelled,
    int checkpoints,
    LedgerSnapshot ledger) {

  public RunOutcome {
    progress = Map.copyOf(progress);
  }
}
