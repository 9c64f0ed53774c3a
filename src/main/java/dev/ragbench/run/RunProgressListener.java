package dev.ragbench.run;

import java.util.Map;

/**
 * Called every {@code progressInterval} attempts with per-pipeline tallies.
 *
 * <p>Invoked from worker threads; implementations must be thread-safe. Returning {@link
 * ProgressDecision#STOP} cancels the run: questions not yet dispatched stay untested for a later
 * resume.
 */
@FunctionalInterface
public interface RunProgressListener {

  RunProgressListener NONE = (attempts, progress) -> ProgressDecision.CONTINUE;

  ProgressDecision onProgress(int attempts, Map<String, PipelineProgress> progress);
}
